package com.shinmonzen.backend.services.invoices.detection;

import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.shinmonzen.backend.services.invoices.util.NormalizeUtil;

import lombok.RequiredArgsConstructor;

/**
 * Pure lookup from (filename, text) to vendor and strategy. No scoring: the first catalog
 * entry with a detection substring inside the folded "filename + text" wins.
 */
@Component
@RequiredArgsConstructor
public class VendorDetector {

    private final VendorCatalog vendorCatalog;

    public Optional<VendorMatch> detect(String filename, String text) {
        String haystack = NormalizeUtil.normalize(safe(filename) + " " + safe(text));
        if (haystack.isEmpty()) return Optional.empty();

        for (VendorPattern pattern : vendorCatalog.getPatterns()) {
            for (String substring : pattern.detectionSubstrings()) {
                String needle = NormalizeUtil.normalize(substring);
                if (!needle.isEmpty() && haystack.contains(needle)) {
                    return Optional.of(new VendorMatch(pattern.vendorName(), pattern.strategy(), substring));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Strategy for a PDF: the matched vendor's strategy, or the vision model when nothing matched.
     */
    public ExtractionStrategy selectStrategy(Optional<VendorMatch> match) {
        return match.map(VendorMatch::strategy).orElse(ExtractionStrategy.AI);
    }

    public static DocumentKind kindOf(String filename) {
        String name = safe(filename).trim().toLowerCase(Locale.ROOT);
        if (name.endsWith(".xlsx") || name.endsWith(".xlsm") || name.endsWith(".xls")) return DocumentKind.WORKBOOK;
        if (name.endsWith(".csv")) return DocumentKind.CSV;
        return DocumentKind.PDF;
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }

    public enum DocumentKind {
        PDF,
        WORKBOOK,
        CSV;

        public boolean isSpreadsheet() {
            return this != PDF;
        }
    }
}
