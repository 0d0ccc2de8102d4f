package com.shinmonzen.backend.services.invoices.parsers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.shinmonzen.backend.config.ExtractionProperties;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;
import com.shinmonzen.backend.services.invoices.model.Unit;

class FrenchFnbInvoiceParserTest {

    private final FrenchFnbInvoiceParser parser = new FrenchFnbInvoiceParser(new ExtractionProperties());

    @Test
    void caviarCansBecomeGrams() {
        List<LineItemRecord> records = parser.extractLineItems("KAVIARI キャビア 22缶 ¥429,000", null);

        assertEquals(1, records.size());
        LineItemRecord caviar = records.get(0);
        assertEquals(FrenchFnbInvoiceParser.CAVIAR, caviar.getItemName());
        assertEquals(0, caviar.getQuantity().compareTo(new BigDecimal("2200")));
        assertEquals(Unit.G, caviar.getUnit());
        assertEquals(0, caviar.getAmount().compareTo(new BigDecimal("429000")));
        assertEquals(0, caviar.getUnitPrice().compareTo(new BigDecimal("195")));
    }

    @Test
    void productSummaryWithWrappedQuantity() {
        String text = String.join("\n",
                "商品別金額表",
                "2025/10/01",
                "KAVIARI キャビア クリスタル 100g",
                "3缶 ¥58,500",
                "パレット バター 20g 10PC ¥6,800",
                "生 スモールジロール 1.5kg ¥12,000",
                "シャンパン ヴィネガー 500ml 2本 ¥3,600"
        );

        assertTrue(FrenchFnbInvoiceParser.isProductSummary(text));
        List<LineItemRecord> records = parser.extractLineItems(text, null);

        assertEquals(4, records.size());

        assertEquals(FrenchFnbInvoiceParser.CAVIAR, records.get(0).getItemName());
        assertEquals(0, records.get(0).getQuantity().compareTo(new BigDecimal("300")));
        assertEquals(LocalDate.of(2025, 10, 1), records.get(0).getDate());

        assertEquals(FrenchFnbInvoiceParser.BUTTER, records.get(1).getItemName());
        assertEquals(Unit.PC, records.get(1).getUnit());
        assertEquals(0, records.get(1).getQuantity().compareTo(BigDecimal.TEN));

        assertEquals(FrenchFnbInvoiceParser.GIROLLE, records.get(2).getItemName());
        assertEquals(Unit.KG, records.get(2).getUnit());
        assertEquals(0, records.get(2).getQuantity().compareTo(new BigDecimal("1.5")));

        assertEquals(FrenchFnbInvoiceParser.VINEGAR, records.get(3).getItemName());
        assertEquals(Unit.BOTTLE, records.get(3).getUnit());
        assertEquals(0, records.get(3).getAmount().compareTo(new BigDecimal("3600")));
    }

    @Test
    void invoiceFormatAmountOnlyLinesAreOnePiece() {
        String text = String.join("\n",
                "フレンチ・エフ・アンド・ビー・ジャパン株式会社 御請求書",
                "2025/10/05 KAVIARI キャビア クリスタル 100g ¥195,000",
                "2025/10/12 パレット バター 20g ¥6,800",
                "2025/10/12 パレット バター 20g ¥6,800"
        );

        assertFalse(FrenchFnbInvoiceParser.isProductSummary(text));
        List<LineItemRecord> records = parser.extractLineItems(text, null);

        assertEquals(2, records.size());
        assertEquals(0, records.get(0).getQuantity().compareTo(BigDecimal.ONE));
        assertEquals(Unit.PC, records.get(0).getUnit());
        assertEquals(0, records.get(0).getAmount().compareTo(new BigDecimal("195000")));
        assertEquals(LocalDate.of(2025, 10, 12), records.get(1).getDate());
    }

    @Test
    void linesForOtherProductsAreIgnored() {
        assertTrue(parser.extractLineItems("送料 ¥1,200\n消費税 ¥3,400", null).isEmpty());
    }
}
