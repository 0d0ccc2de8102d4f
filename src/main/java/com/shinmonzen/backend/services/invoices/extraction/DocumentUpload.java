package com.shinmonzen.backend.services.invoices.extraction;

public record DocumentUpload(String filename, byte[] content) {
}
