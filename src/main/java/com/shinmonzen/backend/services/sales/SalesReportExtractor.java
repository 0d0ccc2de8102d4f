package com.shinmonzen.backend.services.sales;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.shinmonzen.backend.services.invoices.spreadsheet.SpreadsheetReader;
import com.shinmonzen.backend.services.invoices.util.AmountParser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * POS "product sales" CSV export. Layout:
 * <pre>
 * Product Sales Report
 * Period: 2025-10-01 - 2025-10-31
 * Code,Name,Dept,Category,...,Price,Qty,Gross,Discount,...,Net
 * A001,Wagyu Tenderloin,Food,Main,,12000,3,"36,000",0,,"36,000"
 * ,,,Sub Total:,...
 * </pre>
 * Rows before the Code/Name header are report preamble.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SalesReportExtractor {

    private static final Pattern PERIOD_DATE = Pattern.compile("(\\d{4})-(\\d{2})-\\d{2}");
    private static final int PERIOD_SCAN_LINES = 10;

    private static final List<String> SKIP_MARKERS = List.of(
            "Total:", "Sub Total:", "Outlet Total:", "Shop Total:", "Grand Total",
            "END OF REPORT", "Department:", "Outlet:", "Check Type:");

    static final int COL_CODE = 0;
    static final int COL_NAME = 1;
    static final int COL_CATEGORY = 3;
    static final int COL_PRICE = 5;
    static final int COL_QTY = 6;
    static final int COL_GROSS = 7;
    static final int COL_DISCOUNT = 8;
    static final int COL_NET = 10;
    static final int MIN_FIELDS = 11;

    private final SpreadsheetReader reader;

    public List<SalesRecord> extract(byte[] content) {
        List<List<String>> rows = new ArrayList<>();
        for (List<Object> row : reader.readCsvRows(content)) {
            List<String> fields = new ArrayList<>(row.size());
            for (Object cell : row) {
                fields.add(cell == null ? "" : cell.toString().trim());
            }
            rows.add(fields);
        }

        YearMonth month = findPeriod(rows);
        List<SalesRecord> out = new ArrayList<>();
        boolean inData = false;
        int skipped = 0;

        for (List<String> fields : rows) {
            if (isHeader(fields)) {
                inData = true;
                continue;
            }
            if (!inData) continue;

            String joined = String.join(" ", fields);
            if (SKIP_MARKERS.stream().anyMatch(joined::contains) || fields.size() < MIN_FIELDS) {
                skipped++;
                continue;
            }

            String code = fields.get(COL_CODE);
            String name = fields.get(COL_NAME);
            if (code.isEmpty() || name.isEmpty()) {
                skipped++;
                continue;
            }

            BigDecimal price = number(fields.get(COL_PRICE));
            BigDecimal qty = number(fields.get(COL_QTY));
            BigDecimal gross = number(fields.get(COL_GROSS));
            BigDecimal discount = number(fields.get(COL_DISCOUNT));
            BigDecimal net = number(fields.get(COL_NET));
            if (price == null || qty == null || gross == null || discount == null || net == null) {
                skipped++;
                continue;
            }

            out.add(SalesRecord.builder()
                    .code(code)
                    .name(name)
                    .category(fields.get(COL_CATEGORY))
                    .quantity(qty)
                    .price(price)
                    .grossTotal(gross)
                    .discount(discount)
                    .netTotal(net)
                    .month(month)
                    .build());
        }

        log.info("[Sales] Parsed sales report: rows={} skipped={} month={}", out.size(), skipped, month);
        return out;
    }

    private static YearMonth findPeriod(List<List<String>> rows) {
        int limit = Math.min(rows.size(), PERIOD_SCAN_LINES);
        for (int i = 0; i < limit; i++) {
            Matcher m = PERIOD_DATE.matcher(String.join(",", rows.get(i)));
            if (m.find()) {
                int monthValue = Integer.parseInt(m.group(2));
                if (monthValue >= 1 && monthValue <= 12) {
                    return YearMonth.of(Integer.parseInt(m.group(1)), monthValue);
                }
            }
        }
        return null;
    }

    private static boolean isHeader(List<String> fields) {
        return fields.size() >= 8 && fields.get(COL_CODE).contains("Code") && fields.get(COL_NAME).contains("Name");
    }

    /**
     * Empty cells count as zero; anything else must parse.
     */
    private static BigDecimal number(String raw) {
        if (raw == null || raw.isBlank()) return BigDecimal.ZERO;
        return AmountParser.parse(raw);
    }
}
