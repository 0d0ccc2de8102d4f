package com.shinmonzen.backend.services.invoices.parsers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.shinmonzen.backend.services.invoices.detection.ExtractionStrategy;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionTrace;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;
import com.shinmonzen.backend.services.invoices.model.Unit;
import com.shinmonzen.backend.services.invoices.util.AmountParser;
import com.shinmonzen.backend.services.invoices.util.InvoiceDates;
import com.shinmonzen.backend.services.invoices.util.NormalizeUtil;
import com.shinmonzen.backend.services.invoices.util.UnitNormalizer;

/**
 * Maruyata seafood statements: one delivery per row,
 * "10/03 本マグロ 中トロ 1.25 kg 8,800 11,000". The year comes from the statement header, or from
 * the current month when the header is missing.
 */
public class MaruyataInvoiceParser implements InvoiceParserStrategy {

    static final String VENDOR = "Maruyata";

    private static final Pattern ITEM_LINE = Pattern.compile(
            "^(?:(\\d{1,2})/(\\d{1,2})\\s+)?(.+?)\\s+(\\d+(?:\\.\\d+)?)\\s*(kg|g|pc|pcs|個|本|パック|箱|缶|袋|尾|枚)\\s+[¥\\\\]?([\\d,]+(?:\\.\\d+)?)\\s+[¥\\\\]?([\\d,]+)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DATE_ONLY = Pattern.compile("^(\\d{1,2})/(\\d{1,2})$");

    private static final Pattern SLIP_NUMBER = Pattern.compile("^\\d{4,}\\s+");

    private static final BigDecimal TOLERANCE = new BigDecimal("0.02");

    private final Clock clock;

    public MaruyataInvoiceParser(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ExtractionStrategy strategy() {
        return ExtractionStrategy.MARUYATA;
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
        YearMonth reference = invoiceMonth != null ? invoiceMonth : YearMonth.now(clock);

        List<LineItemRecord> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int duplicates = 0;
        int inconsistent = 0;

        for (String raw : NormalizeUtil.toHalfWidth(text).split("\\r?\\n")) {
            String line = raw.replace('|', ' ').replaceAll("\\s+", " ").trim();
            if (line.isEmpty() || isSummaryLine(line)) continue;

            Matcher dateOnly = DATE_ONLY.matcher(line);
            if (dateOnly.matches()) {
                LocalDate d = buildDate(reference, dateOnly.group(1), dateOnly.group(2));
                if (d != null) currentDate = d;
                continue;
            }

            Matcher m = ITEM_LINE.matcher(line);
            if (!m.matches()) continue;

            if (m.group(1) != null) {
                LocalDate d = buildDate(reference, m.group(1), m.group(2));
                if (d != null) currentDate = d;
            }

            String itemName = SLIP_NUMBER.matcher(m.group(3).trim()).replaceFirst("").trim();
            BigDecimal quantity = AmountParser.parse(m.group(4));
            Unit unit = UnitNormalizer.normalizeUnit(m.group(5));
            BigDecimal unitPrice = AmountParser.parse(m.group(6));
            BigDecimal amount = AmountParser.parse(m.group(7));
            if (itemName.isEmpty() || quantity == null || unitPrice == null || amount == null) continue;

            if (!isConsistent(quantity, unitPrice, amount)) {
                inconsistent++;
                continue;
            }

            String key = currentDate + "|" + itemName + "|" + quantity.stripTrailingZeros().toPlainString() + "|" + amount.toPlainString();
            if (!seen.add(key)) {
                duplicates++;
                continue;
            }

            out.add(LineItemRecord.builder()
                    .vendor(VENDOR)
                    .date(currentDate)
                    .itemName(itemName)
                    .quantity(quantity)
                    .unit(unit)
                    .unitPrice(unitPrice)
                    .amount(amount)
                    .build());
        }

        if (trace != null) {
            trace.add("Maruyata parser: {} records, {} duplicate lines collapsed, {} lines failing qty x price = amount",
                    out.size(), duplicates, inconsistent);
        }
        return out;
    }

    private static boolean isSummaryLine(String line) {
        return line.contains("合計") || line.contains("小計") || line.contains("消費税") || line.contains("振込");
    }

    // qty x price must land within 2% of the printed amount, otherwise a digit was misread
    private static boolean isConsistent(BigDecimal quantity, BigDecimal unitPrice, BigDecimal amount) {
        BigDecimal expected = quantity.multiply(unitPrice);
        BigDecimal diff = expected.subtract(amount).abs();
        BigDecimal allowed = amount.abs().multiply(TOLERANCE).max(BigDecimal.ONE);
        return diff.compareTo(allowed) <= 0;
    }

    private static LocalDate buildDate(YearMonth reference, String month, String day) {
        int m = Integer.parseInt(month);
        int d = Integer.parseInt(day);
        int year = reference.getYear();
        // December deliveries on a January statement
        if (m > reference.getMonthValue()) year--;
        return InvoiceDates.dateOrNull(year, m, d);
    }
}
