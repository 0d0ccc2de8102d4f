package com.shinmonzen.backend.services.invoices.util;

import java.text.Normalizer;
import java.util.Locale;

public final class NormalizeUtil {

    private NormalizeUtil() {
    }

    /**
     * Folds text for keyword search: NFKC (full-width digits/latin and half-width katakana
     * become their canonical forms), lowercase, PDF separators collapsed into single spaces.
     * Example: "ＫＡＶＩＡＲＩ　ｷｬﾋﾞｱ" => "kaviari キャビア"
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) return "";

        String result = Normalizer.normalize(text, Normalizer.Form.NFKC);
        result = result.toLowerCase(Locale.ROOT);

        // PDFBox often emits NBSP and other separators that do not match \s.
        result = result.replace('\u00A0', ' ');
        result = result.replaceAll("\\p{Z}+", " ");
        result = result.replaceAll("\\s+", " ").trim();

        return result;
    }

    /**
     * NFKC only, keeping case and line breaks. Used before regex parsing so that
     * full-width digits and yen signs from OCR/PDF text match ASCII patterns.
     */
    public static String toHalfWidth(String text) {
        if (text == null) return "";
        return Normalizer.normalize(text, Normalizer.Form.NFKC).replace('\u00A0', ' ');
    }

    public static boolean containsAny(String text, String... keywords) {
        if (text == null || keywords == null) return false;
        String n = normalize(text);
        for (String k : keywords) {
            if (k != null && n.contains(normalize(k))) return true;
        }
        return false;
    }

    public static String blankToNull(String value) {
        if (value == null) return null;
        String v = value.trim();
        return v.isEmpty() ? null : v;
    }
}
