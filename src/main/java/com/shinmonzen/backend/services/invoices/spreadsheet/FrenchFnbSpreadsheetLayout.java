package com.shinmonzen.backend.services.invoices.spreadsheet;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.shinmonzen.backend.config.ExtractionProperties;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionTrace;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;
import com.shinmonzen.backend.services.invoices.model.Unit;
import com.shinmonzen.backend.services.invoices.parsers.FrenchFnbInvoiceParser;
import com.shinmonzen.backend.services.invoices.util.AmountParser;
import com.shinmonzen.backend.services.invoices.util.InvoiceDates;
import com.shinmonzen.backend.services.invoices.util.NormalizeUtil;
import com.shinmonzen.backend.services.invoices.util.UnitNormalizer;

import lombok.RequiredArgsConstructor;

/**
 * French F&amp;B Japan monthly export: the product table lives far to the right of the sheet.
 */
@Component
@RequiredArgsConstructor
public class FrenchFnbSpreadsheetLayout implements KnownSpreadsheetLayout {

    static final String HEADER_SIGNATURE = "[商品名]";

    static final int COL_DATE = 15;
    static final int COL_PRODUCT = 30;
    static final int COL_UNIT_PRICE = 32;
    static final int COL_QUANTITY = 33;
    static final int COL_UNIT = 34;
    static final int COL_AMOUNT = 35;

    private final ExtractionProperties properties;

    @Override
    public String name() {
        return "french_fnb";
    }

    @Override
    public boolean matches(String filename, List<SheetTable> sheets) {
        if (NormalizeUtil.containsAny(filename, "french", "フレンチ", "kaviari")) return true;
        for (SheetTable sheet : sheets) {
            for (List<Object> row : sheet.rows()) {
                for (Object cell : row) {
                    if (cell instanceof String s && HEADER_SIGNATURE.equals(s.trim())) return true;
                }
            }
        }
        return false;
    }

    @Override
    public List<LineItemRecord> extract(List<SheetTable> sheets, ExtractionTrace trace) {
        List<LineItemRecord> out = new ArrayList<>();
        int shipping = 0;
        int nonPositive = 0;

        for (SheetTable sheet : sheets) {
            for (int r = 0; r < sheet.rows().size(); r++) {
                String product = sheet.text(r, COL_PRODUCT);
                if (product == null || HEADER_SIGNATURE.equals(product)) continue;
                if (product.contains("運賃")) {
                    shipping++;
                    continue;
                }

                BigDecimal amount = AmountParser.parseObject(sheet.cell(r, COL_AMOUNT));
                if (amount == null) continue;
                if (amount.signum() <= 0) {
                    nonPositive++;
                    continue;
                }

                BigDecimal quantity = AmountParser.parseObject(sheet.cell(r, COL_QUANTITY));
                BigDecimal unitPrice = AmountParser.parseObject(sheet.cell(r, COL_UNIT_PRICE));
                String rawUnit = sheet.text(r, COL_UNIT);
                Unit unit = UnitNormalizer.normalizeUnit(rawUnit);
                LocalDate date = InvoiceDates.parseObject(sheet.cell(r, COL_DATE));

                if (quantity != null && isCaviarCan(product, unit)) {
                    quantity = UnitNormalizer.toGrams(quantity, Unit.CAN, properties.getContainerDefaultGrams());
                    unit = Unit.G;
                    unitPrice = quantity.signum() == 0 ? null : amount.divide(quantity, 2, RoundingMode.HALF_UP);
                }

                out.add(LineItemRecord.builder()
                        .vendor(FrenchFnbInvoiceParser.VENDOR)
                        .date(date)
                        .itemName(product)
                        .quantity(quantity)
                        .unit(unit)
                        .unitPrice(unitPrice)
                        .amount(amount)
                        .build());
            }
        }

        trace.add("[Spreadsheet] French F&B layout: {} rows across {} sheets, {} shipping rows and {} non-positive amounts skipped",
                out.size(), sheets.size(), shipping, nonPositive);
        return out;
    }

    private static boolean isCaviarCan(String product, Unit unit) {
        return unit == Unit.CAN && NormalizeUtil.containsAny(product, "キャビア", "kaviari");
    }
}
