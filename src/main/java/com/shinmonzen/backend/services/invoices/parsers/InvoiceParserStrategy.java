package com.shinmonzen.backend.services.invoices.parsers;

import java.time.YearMonth;
import java.util.List;

import com.shinmonzen.backend.services.invoices.detection.ExtractionStrategy;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionTrace;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;

/**
 * Deterministic text parser for one vendor's invoice layout. Implementations keep no state
 * between calls; an empty result means "escalate", not failure.
 */
public interface InvoiceParserStrategy {

    ExtractionStrategy strategy();

    String vendorName();

    YearMonth extractInvoiceMonth(String text);

    List<LineItemRecord> extractLineItems(String text, ExtractionTrace trace);
}
