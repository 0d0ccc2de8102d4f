package com.shinmonzen.backend.services.invoices.extraction;

/**
 * A document could not be read at all (corrupt PDF, unreadable workbook, undecodable CSV).
 * Never crosses the pipeline boundary: it is recorded in the trace and yields zero records.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
