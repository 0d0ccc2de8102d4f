package com.shinmonzen.backend.services.invoices.detection;

import java.util.List;
import java.util.Objects;

/**
 * One row of the vendor table: canonical name, detection substrings and preferred strategy.
 */
public record VendorPattern(String vendorName, List<String> detectionSubstrings, ExtractionStrategy strategy) {

    public VendorPattern {
        Objects.requireNonNull(vendorName, "vendorName");
        Objects.requireNonNull(strategy, "strategy");
        detectionSubstrings = detectionSubstrings == null ? List.of() : List.copyOf(detectionSubstrings);
    }
}
