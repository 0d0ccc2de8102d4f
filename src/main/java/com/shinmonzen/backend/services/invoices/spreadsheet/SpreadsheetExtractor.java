package com.shinmonzen.backend.services.invoices.spreadsheet;

import java.util.List;

import org.springframework.stereotype.Service;

import com.shinmonzen.backend.services.invoices.detection.VendorDetector.DocumentKind;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionSession;
import com.shinmonzen.backend.services.invoices.extraction.StrategyAttempt;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;

import lombok.RequiredArgsConstructor;

/**
 * Spreadsheet path of the escalation chain: known fixed layouts first, then column-role detection.
 * There is no vision fallback for spreadsheets.
 */
@Service
@RequiredArgsConstructor
public class SpreadsheetExtractor {

    private final SpreadsheetReader reader;
    private final List<KnownSpreadsheetLayout> knownLayouts;
    private final GenericSpreadsheetExtractor genericExtractor;

    public List<LineItemRecord> extract(ExtractionSession session) {
        List<SheetTable> sheets = session.getKind() == DocumentKind.CSV
                ? reader.readCsv(session.getContent())
                : reader.readWorkbook(session.getContent());
        session.getTrace().add("[Spreadsheet] {} loaded: {} sheet(s)", session.getKind(), sheets.size());

        for (KnownSpreadsheetLayout layout : knownLayouts) {
            if (!layout.matches(session.getFilename(), sheets)) continue;

            List<LineItemRecord> records = layout.extract(sheets, session.getTrace());
            String strategy = "spreadsheet:" + layout.name();
            if (!records.isEmpty()) {
                session.recordAttempt(StrategyAttempt.success(strategy, records.size(), "known layout"));
                return records;
            }
            session.recordAttempt(StrategyAttempt.failure(strategy, "layout matched but no rows extracted"));
        }

        List<LineItemRecord> records = genericExtractor.extract(sheets, session.getTrace());
        if (records.isEmpty()) {
            session.recordAttempt(StrategyAttempt.failure("spreadsheet:generic", "no rows with item name and amount"));
            session.getTrace().add("[Spreadsheet] No vision fallback for spreadsheets, zero records");
        } else {
            session.recordAttempt(StrategyAttempt.success("spreadsheet:generic", records.size(), "column roles"));
        }
        return records;
    }
}
