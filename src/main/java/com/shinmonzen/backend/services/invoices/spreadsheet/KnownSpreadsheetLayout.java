package com.shinmonzen.backend.services.invoices.spreadsheet;

import java.util.List;

import com.shinmonzen.backend.services.invoices.extraction.ExtractionTrace;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;

/**
 * Vendor export with fixed column positions. Tried before column-role detection.
 */
public interface KnownSpreadsheetLayout {

    String name();

    boolean matches(String filename, List<SheetTable> sheets);

    List<LineItemRecord> extract(List<SheetTable> sheets, ExtractionTrace trace);
}
