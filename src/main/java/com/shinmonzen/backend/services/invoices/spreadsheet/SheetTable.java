package com.shinmonzen.backend.services.invoices.spreadsheet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One sheet as rows of cell values: String, BigDecimal, LocalDate or null.
 */
public record SheetTable(String name, List<List<Object>> rows) {

    public SheetTable {
        List<List<Object>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<Object> row : rows) {
                copy.add(row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        rows = Collections.unmodifiableList(copy);
    }

    public Object cell(int row, int column) {
        if (row < 0 || row >= rows.size()) return null;
        List<Object> r = rows.get(row);
        return column >= 0 && column < r.size() ? r.get(column) : null;
    }

    public String text(int row, int column) {
        Object v = cell(row, column);
        if (v == null) return null;
        String s = v.toString().trim();
        return s.isEmpty() ? null : s;
    }
}
