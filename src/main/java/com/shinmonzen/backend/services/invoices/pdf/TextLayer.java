package com.shinmonzen.backend.services.invoices.pdf;

/**
 * Embedded text of a PDF. {@code scanned} is true when the text layer is too thin to parse
 * (image-only scans, or PDFs whose fonts map to nothing).
 */
public record TextLayer(String text, int pageCount, int unreadablePages, boolean scanned) {
}
