package com.shinmonzen.backend.services.invoices.detection;

/**
 * Extraction handler selected once per document and passed down the call chain.
 */
public enum ExtractionStrategy {
    HIRAYAMA("hirayama"),
    FRENCH_FNB("french_fnb"),
    MARUYATA("maruyata"),
    AI("ai"),
    SPREADSHEET("spreadsheet");

    private final String id;

    ExtractionStrategy(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean usesRegexParser() {
        return this == HIRAYAMA || this == FRENCH_FNB || this == MARUYATA;
    }
}
