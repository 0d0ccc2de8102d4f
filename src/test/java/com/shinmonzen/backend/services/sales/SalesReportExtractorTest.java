package com.shinmonzen.backend.services.sales;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.YearMonth;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.shinmonzen.backend.services.invoices.spreadsheet.SpreadsheetReader;

class SalesReportExtractorTest {

    private final SalesReportExtractor extractor = new SalesReportExtractor(new SpreadsheetReader());

    private static byte[] csv(String... lines) {
        return String.join("\n", lines).getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void parsesProductRowsAndSkipsTotals() {
        byte[] content = csv(
                "Product Sales Report",
                "Period: 2025-10-01 - 2025-10-31",
                "Code,Name,Dept,Category,Sub,Price,Qty,Gross,Discount,Service,Net",
                "A001,Wagyu Tenderloin,Food,Main,,12000,3,\"36,000\",0,,\"36,000\"",
                "A002,Sea Bream,Food,Main,,3200,,,0,,",
                ",,,Sub Total:,,,,,,,",
                "A003,Broken Row,Food,Main,,abc,1,100,0,,100",
                "Grand Total,,,,,,,,,,");

        List<SalesRecord> records = extractor.extract(content);

        assertEquals(2, records.size());

        SalesRecord wagyu = records.get(0);
        assertEquals("A001", wagyu.getCode());
        assertEquals("Wagyu Tenderloin", wagyu.getName());
        assertEquals("Main", wagyu.getCategory());
        assertEquals(0, wagyu.getQuantity().compareTo(new BigDecimal("3")));
        assertEquals(0, wagyu.getGrossTotal().compareTo(new BigDecimal("36000")));
        assertEquals(YearMonth.of(2025, 10), wagyu.getMonth());

        SalesRecord bream = records.get(1);
        assertEquals(0, bream.getQuantity().compareTo(BigDecimal.ZERO));
        assertEquals(0, bream.getNetTotal().compareTo(BigDecimal.ZERO));
    }

    @Test
    void rowsBeforeHeaderAreIgnored() {
        byte[] content = csv(
                "A000,Not Data,Food,Main,,1,1,1,0,,1",
                "Code,Name,Dept,Category,Sub,Price,Qty,Gross,Discount,Service,Net",
                "A001,Oyster,Food,Starter,,800,5,4000,0,,4000");

        List<SalesRecord> records = extractor.extract(content);

        assertEquals(1, records.size());
        assertEquals("Oyster", records.get(0).getName());
        assertEquals(null, records.get(0).getMonth());
    }

    @Test
    void reportWithoutHeaderYieldsNothing() {
        assertTrue(extractor.extract(csv("Product Sales Report", "nothing here")).isEmpty());
    }
}
