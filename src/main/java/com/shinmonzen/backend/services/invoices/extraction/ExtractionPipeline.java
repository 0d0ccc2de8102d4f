package com.shinmonzen.backend.services.invoices.extraction;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

import com.shinmonzen.backend.config.ExtractionProperties;
import com.shinmonzen.backend.services.invoices.detection.ExtractionStrategy;
import com.shinmonzen.backend.services.invoices.detection.VendorDetector;
import com.shinmonzen.backend.services.invoices.detection.VendorDetector.DocumentKind;
import com.shinmonzen.backend.services.invoices.detection.VendorMatch;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;
import com.shinmonzen.backend.services.invoices.parsers.InvoiceParserFactory;
import com.shinmonzen.backend.services.invoices.parsers.InvoiceParserStrategy;
import com.shinmonzen.backend.services.invoices.pdf.PdfTextExtractor;
import com.shinmonzen.backend.services.invoices.pdf.TextLayer;
import com.shinmonzen.backend.services.invoices.spreadsheet.SpreadsheetExtractor;
import com.shinmonzen.backend.services.invoices.vision.VisionExtractor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Escalation chain for one document: cheapest reliable method first, vision model last.
 * <p>
 * {@link #extract(String, byte[])} never throws. Unreadable input, parser bugs and model failures
 * all end as an empty record list with the reason in the trace.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractionPipeline {

    static final String VISION = "vision";

    private final VendorDetector vendorDetector;
    private final InvoiceParserFactory invoiceParserFactory;
    private final PdfTextExtractor pdfTextExtractor;
    private final VisionExtractor visionExtractor;
    private final SpreadsheetExtractor spreadsheetExtractor;
    private final RecordDefaults recordDefaults;
    private final ExtractionProperties extractionProperties;

    public ExtractionResult extract(String filename, byte[] content) {
        DocumentKind kind = VendorDetector.kindOf(filename);
        ExtractionSession session = new ExtractionSession(filename, content, kind);
        ExtractionTrace trace = session.getTrace();
        long start = System.currentTimeMillis();

        trace.add("Session started: file='{}' kind={} bytes={}", session.getFilename(), kind, session.getContent().length);
        try {
            if (session.getContent().length == 0) {
                throw new ExtractionException("Empty document");
            }

            List<LineItemRecord> candidates = kind.isSpreadsheet()
                    ? extractSpreadsheet(session)
                    : extractPdf(session);

            session.setRecords(recordDefaults.apply(candidates, documentVendor(session), session.getDocumentDate(), trace));
        } catch (RuntimeException e) {
            trace.add("Extraction aborted, zero records: {}: {}", e.getClass().getSimpleName(), e.getMessage());
            log.warn("[Extraction][{}] Failed for '{}': {}", session.getId(), session.getFilename(), e.toString());
            session.setRecords(List.of());
        }

        trace.add("Session finished: {} records, strategy={}, {} ms",
                session.getRecords().size(), session.getStrategy(), System.currentTimeMillis() - start);
        return session.toResult();
    }

    private List<LineItemRecord> extractSpreadsheet(ExtractionSession session) {
        // spreadsheets are routed by extension; vendor detection is PDF-only
        session.setStrategy(ExtractionStrategy.SPREADSHEET);
        return spreadsheetExtractor.extract(session);
    }

    private List<LineItemRecord> extractPdf(ExtractionSession session) {
        ExtractionTrace trace = session.getTrace();
        Path scratch = writeScratchCopy(session);
        try (PDDocument document = PDDocument.load(scratch.toFile())) {
            TextLayer layer = pdfTextExtractor.extract(document, trace);
            session.setScanned(layer.scanned());

            Optional<VendorMatch> match = vendorDetector.detect(session.getFilename(), layer.text());
            ExtractionStrategy strategy = vendorDetector.selectStrategy(match);
            session.setVendor(match.orElse(null));
            session.setStrategy(strategy);
            if (match.isPresent()) {
                trace.add("Vendor '{}' matched on '{}', strategy {}", match.get().vendorName(), match.get().matchedSubstring(), strategy.id());
            } else {
                trace.add("No vendor pattern matched, strategy {}", strategy.id());
            }

            if (strategy.usesRegexParser()) {
                List<LineItemRecord> records = runRegexParser(session, strategy, layer);
                if (!records.isEmpty()) return records;
            }

            session.setStrategy(ExtractionStrategy.AI);
            List<LineItemRecord> records = visionExtractor.extract(document, session);
            session.recordAttempt(records.isEmpty()
                    ? StrategyAttempt.failure(VISION, "escalation exhausted")
                    : StrategyAttempt.success(VISION, records.size(), null));
            return records;
        } catch (IOException e) {
            throw new ExtractionException("Unreadable PDF: " + e.getMessage(), e);
        } finally {
            deleteScratchCopy(scratch, trace);
        }
    }

    private List<LineItemRecord> runRegexParser(ExtractionSession session, ExtractionStrategy strategy, TextLayer layer) {
        if (layer.scanned()) {
            session.recordAttempt(StrategyAttempt.failure(strategy.id(), "skipped, text layer flagged scanned"));
            return List.of();
        }

        Optional<InvoiceParserStrategy> parser = invoiceParserFactory.getParser(strategy);
        if (parser.isEmpty()) {
            session.recordAttempt(StrategyAttempt.failure(strategy.id(), "no parser registered"));
            return List.of();
        }

        List<LineItemRecord> records = parser.get().extractLineItems(layer.text(), session.getTrace());
        if (records.isEmpty()) {
            session.recordAttempt(StrategyAttempt.failure(strategy.id(), "no line matched"));
            return List.of();
        }

        session.setDocumentVendor(parser.get().vendorName());
        YearMonth month = parser.get().extractInvoiceMonth(layer.text());
        if (month != null) session.setDocumentDate(month.atDay(1));
        session.recordAttempt(StrategyAttempt.success(strategy.id(), records.size(), null));
        return records;
    }

    private Path writeScratchCopy(ExtractionSession session) {
        try {
            String dir = extractionProperties.getScratchDir();
            Path path;
            if (dir == null || dir.isBlank()) {
                path = Files.createTempFile("extraction-" + session.getId() + "-", ".pdf");
            } else {
                Path scratchDir = Files.createDirectories(Path.of(dir));
                path = Files.createTempFile(scratchDir, "extraction-" + session.getId() + "-", ".pdf");
            }
            try {
                Files.write(path, session.getContent());
            } catch (IOException e) {
                Files.deleteIfExists(path);
                throw e;
            }
            return path;
        } catch (IOException e) {
            throw new ExtractionException("Could not write scratch copy: " + e.getMessage(), e);
        }
    }

    private static void deleteScratchCopy(Path scratch, ExtractionTrace trace) {
        try {
            Files.deleteIfExists(scratch);
        } catch (IOException e) {
            trace.add("Scratch copy {} could not be deleted: {}", scratch, e.getMessage());
            log.warn("[Extraction] Scratch copy {} left behind: {}", scratch, e.toString());
        }
    }

    private static String documentVendor(ExtractionSession session) {
        if (session.getDocumentVendor() != null) return session.getDocumentVendor();
        return session.getVendor() != null ? session.getVendor().vendorName() : null;
    }
}
