package com.shinmonzen.backend.services.invoices.extraction;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import com.shinmonzen.backend.services.invoices.detection.ExtractionStrategy;
import com.shinmonzen.backend.services.invoices.detection.VendorDetector.DocumentKind;
import com.shinmonzen.backend.services.invoices.detection.VendorMatch;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;

import lombok.Getter;
import lombok.Setter;

/**
 * Ephemeral per-document state. Created when a document enters the pipeline and dropped once
 * {@link ExtractionResult} has been built; never persisted and never shared between documents.
 */
@Getter
public class ExtractionSession {

    private final String filename;
    private final byte[] content;
    private final DocumentKind kind;
    private final ExtractionTrace trace;
    private final List<StrategyAttempt> attempts = new ArrayList<>();

    @Setter
    private VendorMatch vendor;

    @Setter
    private Boolean scanned;

    @Setter
    private ExtractionStrategy strategy;

    /**
     * Document-level vendor name (may come from the vision model header instead of the catalog).
     */
    @Setter
    private String documentVendor;

    @Setter
    private LocalDate documentDate;

    private List<LineItemRecord> records = List.of();

    public ExtractionSession(String filename, byte[] content, DocumentKind kind) {
        this.filename = filename == null ? "" : filename;
        this.content = content == null ? new byte[0] : content;
        this.kind = kind;
        this.trace = ExtractionTrace.newTrace();
    }

    public String getId() {
        return trace.getSessionId();
    }

    public void recordAttempt(StrategyAttempt attempt) {
        attempts.add(attempt);
        trace.add("Strategy '{}' {} ({} records){}",
                attempt.strategy(),
                attempt.succeeded() ? "succeeded" : "yielded nothing",
                attempt.recordCount(),
                attempt.detail() == null || attempt.detail().isBlank() ? "" : ": " + attempt.detail());
    }

    public void setRecords(List<LineItemRecord> records) {
        this.records = records == null ? List.of() : List.copyOf(records);
    }

    public ExtractionResult toResult() {
        return new ExtractionResult(
                filename,
                documentVendor != null ? documentVendor : (vendor != null ? vendor.vendorName() : null),
                strategy,
                scanned,
                records,
                List.copyOf(attempts),
                trace.entries());
    }
}
