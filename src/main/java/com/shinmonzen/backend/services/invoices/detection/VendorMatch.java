package com.shinmonzen.backend.services.invoices.detection;

public record VendorMatch(String vendorName, ExtractionStrategy strategy, String matchedSubstring) {
}
