package com.shinmonzen.backend.services.invoices.spreadsheet;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.shinmonzen.backend.services.invoices.detection.VendorNameMapper;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionTrace;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;
import com.shinmonzen.backend.services.invoices.util.AmountParser;
import com.shinmonzen.backend.services.invoices.util.InvoiceDates;
import com.shinmonzen.backend.services.invoices.util.NormalizeUtil;
import com.shinmonzen.backend.services.invoices.util.UnitNormalizer;

/**
 * Column-role detection for spreadsheets with an unknown layout. Every sheet is handled on its own;
 * rows without an amount or an item name are skipped. Dates left null here are filled in later.
 */
@Component
public class GenericSpreadsheetExtractor {

    private static final int HEADER_SCAN_ROWS = 10;
    private static final int SAMPLE_ROWS = 20;

    public List<LineItemRecord> extract(List<SheetTable> sheets, ExtractionTrace trace) {
        List<LineItemRecord> out = new ArrayList<>();
        for (SheetTable sheet : sheets) {
            out.addAll(extractSheet(sheet, trace));
        }
        return out;
    }

    List<LineItemRecord> extractSheet(SheetTable sheet, ExtractionTrace trace) {
        int headerRow = findHeaderRow(sheet);
        if (headerRow < 0) {
            trace.add("[Spreadsheet] Sheet '{}': no header row", sheet.name());
            return List.of();
        }

        Map<ColumnRole, Integer> columns = detectColumns(sheet, headerRow);
        if (!columns.containsKey(ColumnRole.ITEM_NAME)) {
            int fallback = firstTextColumn(sheet, headerRow, columns);
            if (fallback >= 0) {
                columns.put(ColumnRole.ITEM_NAME, fallback);
                trace.add("[Spreadsheet] Sheet '{}': no item-name header, using text column {}", sheet.name(), fallback);
            }
        }
        trace.add("[Spreadsheet] Sheet '{}': header row {}, columns {}", sheet.name(), headerRow, columns);

        if (!columns.containsKey(ColumnRole.AMOUNT) || !columns.containsKey(ColumnRole.ITEM_NAME)) {
            trace.add("[Spreadsheet] Sheet '{}': amount or item column missing, skipped", sheet.name());
            return List.of();
        }

        List<LineItemRecord> out = new ArrayList<>();
        int skipped = 0;
        for (int r = headerRow + 1; r < sheet.rows().size(); r++) {
            String item = text(sheet, r, columns.get(ColumnRole.ITEM_NAME));
            BigDecimal amount = AmountParser.parseObject(sheet.cell(r, columns.get(ColumnRole.AMOUNT)));
            if (item == null || amount == null || isTotalRow(item)) {
                skipped++;
                continue;
            }

            String vendor = text(sheet, r, columns.get(ColumnRole.VENDOR));
            LocalDate date = columns.containsKey(ColumnRole.DATE)
                    ? InvoiceDates.parseObject(sheet.cell(r, columns.get(ColumnRole.DATE)))
                    : null;

            out.add(LineItemRecord.builder()
                    .vendor(vendor != null ? VendorNameMapper.cleanName(vendor) : null)
                    .date(date)
                    .itemName(item)
                    .quantity(number(sheet, r, columns.get(ColumnRole.QUANTITY)))
                    .unit(UnitNormalizer.normalizeUnit(text(sheet, r, columns.get(ColumnRole.UNIT))))
                    .unitPrice(number(sheet, r, columns.get(ColumnRole.UNIT_PRICE)))
                    .amount(amount)
                    .build());
        }

        trace.add("[Spreadsheet] Sheet '{}': {} rows extracted, {} skipped", sheet.name(), out.size(), skipped);
        return out;
    }

    /**
     * First row (within the top of the sheet) with at least two recognised headers, else the first
     * non-empty row.
     */
    static int findHeaderRow(SheetTable sheet) {
        int firstNonEmpty = -1;
        int limit = Math.min(sheet.rows().size(), HEADER_SCAN_ROWS);
        for (int r = 0; r < limit; r++) {
            List<Object> row = sheet.rows().get(r);
            int recognised = 0;
            boolean empty = true;
            for (Object cell : row) {
                if (cell == null) continue;
                empty = false;
                if (cell instanceof String s && ColumnRole.match(s) != null) recognised++;
            }
            if (recognised >= 2) return r;
            if (!empty && firstNonEmpty < 0) firstNonEmpty = r;
        }
        return firstNonEmpty;
    }

    static Map<ColumnRole, Integer> detectColumns(SheetTable sheet, int headerRow) {
        Map<ColumnRole, Integer> columns = new EnumMap<>(ColumnRole.class);
        List<Object> header = sheet.rows().get(headerRow);
        for (int c = 0; c < header.size(); c++) {
            Object cell = header.get(c);
            if (!(cell instanceof String s)) continue;
            ColumnRole role = ColumnRole.match(s);
            if (role != null) {
                columns.putIfAbsent(role, c);
            }
        }
        return columns;
    }

    /**
     * First unassigned column whose sampled values are all non-numeric text.
     */
    static int firstTextColumn(SheetTable sheet, int headerRow, Map<ColumnRole, Integer> assigned) {
        int width = 0;
        int end = Math.min(sheet.rows().size(), headerRow + 1 + SAMPLE_ROWS);
        for (int r = headerRow; r < end; r++) {
            width = Math.max(width, sheet.rows().get(r).size());
        }

        for (int c = 0; c < width; c++) {
            if (assigned.containsValue(c)) continue;
            boolean sawText = false;
            boolean allText = true;
            for (int r = headerRow + 1; r < end; r++) {
                Object v = sheet.cell(r, c);
                if (v == null) continue;
                if (v instanceof String s && AmountParser.parse(s) == null && InvoiceDates.parseFlexible(s) == null) {
                    sawText = true;
                } else {
                    allText = false;
                    break;
                }
            }
            if (sawText && allText) return c;
        }
        return -1;
    }

    private static boolean isTotalRow(String item) {
        return item.contains("合計") || item.contains("小計") || NormalizeUtil.normalize(item).startsWith("total");
    }

    private static String text(SheetTable sheet, int row, Integer column) {
        if (column == null) return null;
        return sheet.text(row, column);
    }

    private static BigDecimal number(SheetTable sheet, int row, Integer column) {
        if (column == null) return null;
        return AmountParser.parseObject(sheet.cell(row, column));
    }
}
