package com.shinmonzen.backend.services.invoices.parsers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.shinmonzen.backend.config.ExtractionProperties;
import com.shinmonzen.backend.services.invoices.detection.ExtractionStrategy;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionTrace;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;
import com.shinmonzen.backend.services.invoices.model.Unit;
import com.shinmonzen.backend.services.invoices.util.AmountParser;
import com.shinmonzen.backend.services.invoices.util.InvoiceDates;
import com.shinmonzen.backend.services.invoices.util.NormalizeUtil;
import com.shinmonzen.backend.services.invoices.util.UnitNormalizer;

/**
 * French F&amp;B Japan. Handles both the monthly invoice (one product line per delivery, amount only)
 * and the product summary sheet ("商品別金額表", "取引数量" columns carrying quantity + unit).
 * Quantity and amount sometimes wrap onto the line below the product name.
 */
public class FrenchFnbInvoiceParser implements InvoiceParserStrategy {

    public static final String VENDOR = "French F&B Japan";

    static final String CAVIAR = "KAVIARI キャビア クリスタル 100g";
    static final String BUTTER = "パレット バター 20g";
    static final String GIROLLE = "生 スモールジロール";
    static final String VINEGAR = "シャンパン ヴィネガー 500ml";

    private static final Pattern LINE_DATE = Pattern.compile("(?<!\\d)(\\d{4})/(\\d{1,2})/(\\d{1,2})(?!\\d)");

    private static final Pattern CANS = Pattern.compile("(\\d+)\\s*缶\\s*[¥\\\\]?\\s*([\\d,]+)");
    private static final Pattern PIECES = Pattern.compile("(\\d+)\\s*(?:PC|PCS|個)\\s*[¥\\\\]?\\s*([\\d,]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern KILOS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*kg\\s*[¥\\\\]?\\s*([\\d,]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BOTTLES = Pattern.compile("(\\d+)\\s*本\\s*[¥\\\\]?\\s*([\\d,]+)");

    private static final Pattern YEN_AMOUNT = Pattern.compile("[¥\\\\]\\s*([\\d,]*\\d)");
    private static final Pattern GROUPED_AMOUNT = Pattern.compile("(?<![\\d.])(\\d{1,3}(?:,\\d{3})+)(?![\\d.])");

    private enum Product {
        CAVIAR_TIN(FrenchFnbInvoiceParser.CAVIAR, CANS, Unit.CAN),
        PALETTE_BUTTER(FrenchFnbInvoiceParser.BUTTER, PIECES, Unit.PC),
        SMALL_GIROLLE(FrenchFnbInvoiceParser.GIROLLE, KILOS, Unit.KG),
        CHAMPAGNE_VINEGAR(FrenchFnbInvoiceParser.VINEGAR, BOTTLES, Unit.BOTTLE);

        private final String canonicalName;
        private final Pattern quantityPattern;
        private final Unit unit;

        Product(String canonicalName, Pattern quantityPattern, Unit unit) {
            this.canonicalName = canonicalName;
            this.quantityPattern = quantityPattern;
            this.unit = unit;
        }

        static Product identify(String line) {
            if (NormalizeUtil.containsAny(line, "キャビア", "kaviari", "キャヴィア")) return CAVIAR_TIN;
            if (NormalizeUtil.containsAny(line, "パレット", "バター")) return PALETTE_BUTTER;
            if (NormalizeUtil.containsAny(line, "ジロール")) return SMALL_GIROLLE;
            if (NormalizeUtil.containsAny(line, "シャンパン") && NormalizeUtil.containsAny(line, "ヴィネガー", "ビネガー")) {
                return CHAMPAGNE_VINEGAR;
            }
            return null;
        }
    }

    private final BigDecimal gramsPerCan;

    public FrenchFnbInvoiceParser(ExtractionProperties properties) {
        this.gramsPerCan = properties != null ? properties.getContainerDefaultGrams() : BigDecimal.valueOf(100);
    }

    @Override
    public ExtractionStrategy strategy() {
        return ExtractionStrategy.FRENCH_FNB;
    }

    @Override
    public String vendorName() {
        return VENDOR;
    }

    @Override
    public YearMonth extractInvoiceMonth(String text) {
        return InvoiceDates.headerYearMonth(text);
    }

    public static boolean isProductSummary(String text) {
        return text != null && (text.contains("商品別金額表") || text.contains("取引数量"));
    }

    @Override
    public List<LineItemRecord> extractLineItems(String text, ExtractionTrace trace) {
        if (text == null || text.isBlank()) return List.of();

        YearMonth invoiceMonth = extractInvoiceMonth(text);
        LocalDate currentDate = invoiceMonth != null ? invoiceMonth.atDay(1) : null;
        boolean summary = isProductSummary(text);

        List<LineItemRecord> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int duplicates = 0;

        String[] lines = NormalizeUtil.toHalfWidth(text).split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].replaceAll("\\s+", " ").trim();
            if (line.isEmpty()) continue;

            Matcher dateMatcher = LINE_DATE.matcher(line);
            if (dateMatcher.find()) {
                LocalDate lineDate = InvoiceDates.dateOrNull(
                        Integer.parseInt(dateMatcher.group(1)),
                        Integer.parseInt(dateMatcher.group(2)),
                        Integer.parseInt(dateMatcher.group(3)));
                if (lineDate != null) currentDate = lineDate;
            }

            Product product = Product.identify(line);
            if (product == null) continue;

            LineItemRecord record = matchQuantity(product, line, currentDate);
            if (record == null && i + 1 < lines.length) {
                String next = lines[i + 1].replaceAll("\\s+", " ").trim();
                record = matchQuantity(product, next, currentDate);
                if (record != null) i++;
            }
            if (record == null && !summary) {
                record = matchAmountOnly(product, line, currentDate);
            }
            if (record == null) continue;

            String key = record.getDate() + "|" + record.getItemName() + "|"
                    + record.getQuantity().stripTrailingZeros().toPlainString() + "|" + record.getAmount().toPlainString();
            if (!seen.add(key)) {
                duplicates++;
                continue;
            }
            out.add(record);
        }

        if (trace != null) {
            trace.add("French F&B parser ({} format): {} records, {} duplicate lines collapsed",
                    summary ? "product summary" : "invoice", out.size(), duplicates);
        }
        return out;
    }

    private LineItemRecord matchQuantity(Product product, String line, LocalDate date) {
        Matcher m = product.quantityPattern.matcher(line);
        if (!m.find()) return null;

        BigDecimal quantity = AmountParser.parse(m.group(1));
        BigDecimal amount = AmountParser.parse(m.group(2));
        if (quantity == null || amount == null || quantity.signum() == 0) return null;

        Unit unit = product.unit;
        if (unit == Unit.CAN) {
            // Caviar is purchased by weight: one tin = 100 g
            quantity = UnitNormalizer.toGrams(quantity, Unit.CAN, gramsPerCan);
            unit = Unit.G;
        }

        return LineItemRecord.builder()
                .vendor(VENDOR)
                .date(date)
                .itemName(product.canonicalName)
                .quantity(quantity)
                .unit(unit)
                .unitPrice(amount.divide(quantity, 2, RoundingMode.HALF_UP))
                .amount(amount)
                .build();
    }

    private LineItemRecord matchAmountOnly(Product product, String line, LocalDate date) {
        BigDecimal amount = null;
        Matcher yen = YEN_AMOUNT.matcher(line);
        while (yen.find()) {
            BigDecimal candidate = AmountParser.parse(yen.group(1));
            if (candidate != null && candidate.signum() != 0) {
                amount = candidate;
                break;
            }
        }
        if (amount == null) {
            Matcher grouped = GROUPED_AMOUNT.matcher(line);
            while (grouped.find()) {
                amount = AmountParser.parse(grouped.group(1));
            }
        }
        if (amount == null) return null;

        return LineItemRecord.builder()
                .vendor(VENDOR)
                .date(date)
                .itemName(product.canonicalName)
                .quantity(BigDecimal.ONE)
                .unit(Unit.PC)
                .unitPrice(amount)
                .amount(amount)
                .build();
    }
}
