package com.shinmonzen.backend.services.invoices.extraction;

import java.util.List;

import com.shinmonzen.backend.services.invoices.detection.ExtractionStrategy;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;

public record ExtractionResult(
        String filename,
        String vendor,
        ExtractionStrategy strategy,
        Boolean scanned,
        List<LineItemRecord> records,
        List<StrategyAttempt> attempts,
        List<String> trace
) {
    public ExtractionResult {
        records = records == null ? List.of() : List.copyOf(records);
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
        trace = trace == null ? List.of() : List.copyOf(trace);
    }
}
