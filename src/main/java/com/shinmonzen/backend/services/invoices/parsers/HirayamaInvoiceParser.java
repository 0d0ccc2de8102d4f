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

/**
 * Meat Shop Hirayama delivery statements. Typically OCR text, e.g.
 * <pre>
 * 2025年10月31日 締切分
 * 25/10/09 002077 |和生ヒレ | 8% 6.30 kg 12,000 75,600
 * 和牛ヒレ 8% 5.90 kg 12,000 70,800
 * </pre>
 * Lines without a date inherit the last seen "yy/MM/dd".
 */
public class HirayamaInvoiceParser implements InvoiceParserStrategy {

    static final String VENDOR = "Meat Shop Hirayama";
    static final String DEFAULT_ITEM = "和牛ヒレ";

    // OCR misreads of 和牛ヒレ seen on real statements
    private static final List<String> TENDERLOIN_VARIANTS = List.of("和牛ヒレ", "和牛モレ", "和生ヒレ", "和邊ヒレ");

    private static final Pattern SHORT_DATE = Pattern.compile("(?<!\\d)(\\d{2})/(\\d{2})/(\\d{2})(?!\\d)");
    private static final Pattern FULL_DATE = Pattern.compile("(?<!\\d)(\\d{4})/(\\d{1,2})/(\\d{1,2})(?!\\d)");

    // "6.30 kg 12,000 75,600" - ke/kq are common OCR misreads of kg
    private static final Pattern WEIGHT_LINE = Pattern.compile(
            "(?<![\\d.])(\\d+\\.\\d+)\\s*(?:kg|ke|kq)(?:\\s+([\\d,]+))?(?:\\s+([\\d,]+))?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern ITEM_TOKEN = Pattern.compile("([^\\s\\d%/]*(?:ヒレ|モレ|ロース|サーロイン|ランプ|もも|肩)[^\\s\\d%/]*)");

    private final ExtractionProperties.Hirayama limits;

    public HirayamaInvoiceParser(ExtractionProperties properties) {
        this.limits = properties != null ? properties.getHirayama() : new ExtractionProperties.Hirayama();
    }

    @Override
    public ExtractionStrategy strategy() {
        return ExtractionStrategy.HIRAYAMA;
    }

    @Override
    public String vendorName() {
        return VENDOR;
    }

    @Override
    public YearMonth extractInvoiceMonth(String text) {
        return InvoiceDates.headerYearMonth(text);
    }

    @Override
    public List<LineItemRecord> extractLineItems(String text, ExtractionTrace trace) {
        if (text == null || text.isBlank()) return List.of();

        YearMonth invoiceMonth = extractInvoiceMonth(text);
        LocalDate currentDate = invoiceMonth != null ? invoiceMonth.atDay(1) : null;

        List<LineItemRecord> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int duplicates = 0;
        int implausible = 0;

        String[] lines = NormalizeUtil.toHalfWidth(text).replace('|', ' ').split("\\r?\\n");
        for (String raw : lines) {
            String line = raw.replaceAll("\\s+", " ").trim();
            if (line.isEmpty()) continue;

            LocalDate lineDate = extractLineDate(line);
            if (lineDate != null) {
                currentDate = lineDate;
            }

            Matcher m = WEIGHT_LINE.matcher(line);
            while (m.find()) {
                BigDecimal quantity = AmountParser.parse(m.group(1));
                if (quantity == null) continue;

                if (quantity.compareTo(limits.getMinKg()) < 0 || quantity.compareTo(limits.getMaxKg()) > 0) {
                    implausible++;
                    continue;
                }

                BigDecimal[] priceAndAmount = resolvePriceAndAmount(quantity, m.group(2), m.group(3));
                BigDecimal unitPrice = priceAndAmount[0];
                BigDecimal amount = priceAndAmount[1];

                String key = currentDate + "|" + quantity.stripTrailingZeros().toPlainString() + "|" + amount.toPlainString();
                if (!seen.add(key)) {
                    duplicates++;
                    continue;
                }

                out.add(LineItemRecord.builder()
                        .vendor(VENDOR)
                        .date(currentDate)
                        .itemName(extractItemName(line))
                        .quantity(quantity)
                        .unit(Unit.KG)
                        .unitPrice(unitPrice)
                        .amount(amount)
                        .build());
            }
        }

        if (trace != null) {
            trace.add("Hirayama parser: {} records, {} duplicate lines collapsed, {} weights outside [{}..{}] kg rejected",
                    out.size(), duplicates, implausible, limits.getMinKg(), limits.getMaxKg());
        }
        return out;
    }

    private BigDecimal[] resolvePriceAndAmount(BigDecimal quantity, String first, String second) {
        BigDecimal a = AmountParser.parse(first);
        BigDecimal b = AmountParser.parse(second);
        BigDecimal defaultPrice = limits.getDefaultUnitPrice();

        if (a != null && b != null) {
            return new BigDecimal[] { a, b };
        }
        if (a != null) {
            // A lone trailing number is the amount unless it is exactly the list price.
            if (a.compareTo(defaultPrice) == 0) {
                return new BigDecimal[] { a, quantity.multiply(a).setScale(0, RoundingMode.HALF_UP) };
            }
            return new BigDecimal[] { null, a };
        }
        return new BigDecimal[] { defaultPrice, quantity.multiply(defaultPrice).setScale(0, RoundingMode.HALF_UP) };
    }

    private LocalDate extractLineDate(String line) {
        Matcher full = FULL_DATE.matcher(line);
        if (full.find()) {
            return InvoiceDates.dateOrNull(Integer.parseInt(full.group(1)), Integer.parseInt(full.group(2)), Integer.parseInt(full.group(3)));
        }
        Matcher shortDate = SHORT_DATE.matcher(line);
        if (shortDate.find()) {
            return InvoiceDates.dateOrNull(2000 + Integer.parseInt(shortDate.group(1)),
                    Integer.parseInt(shortDate.group(2)),
                    Integer.parseInt(shortDate.group(3)));
        }
        return null;
    }

    private String extractItemName(String line) {
        for (String variant : TENDERLOIN_VARIANTS) {
            if (line.contains(variant)) return DEFAULT_ITEM;
        }
        Matcher m = ITEM_TOKEN.matcher(line);
        if (m.find()) {
            String token = m.group(1).trim();
            if (!token.isEmpty()) return token;
        }
        return DEFAULT_ITEM;
    }
}
