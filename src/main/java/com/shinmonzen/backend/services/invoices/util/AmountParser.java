package com.shinmonzen.backend.services.invoices.util;

import java.math.BigDecimal;

/**
 * Parses yen-style amounts and quantities: "¥429,000", "\429,000", "75,600", "6.30", "△3,000".
 * Comma is always a thousands separator; "△" and "▲" mark negative values.
 */
public final class AmountParser {

    private AmountParser() {
    }

    public static BigDecimal parse(String raw) {
        if (raw == null) return null;
        String s = NormalizeUtil.toHalfWidth(raw).trim();
        if (s.isEmpty()) return null;

        boolean negative = false;
        if (s.startsWith("△") || s.startsWith("▲")) {
            negative = true;
            s = s.substring(1);
        }

        s = s.replace("¥", "")
                .replace("\\", "")
                .replace("円", "")
                .replace(",", "")
                .replace(" ", "")
                .trim();

        if (s.startsWith("(") && s.endsWith(")")) {
            negative = true;
            s = s.substring(1, s.length() - 1);
        }

        if (!s.matches("[-+]?\\d+(\\.\\d+)?")) {
            return null;
        }

        try {
            BigDecimal value = new BigDecimal(s);
            return negative ? value.negate() : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Cell-friendly variant: accepts numbers as-is and strings through {@link #parse(String)}.
     */
    public static BigDecimal parseObject(Object value) {
        if (value == null) return null;
        if (value instanceof BigDecimal bd) return bd;
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            BigDecimal bd = BigDecimal.valueOf(d).stripTrailingZeros();
            return bd.scale() < 0 ? bd.setScale(0) : bd;
        }
        return parse(value.toString());
    }

    public static boolean isZero(BigDecimal value) {
        return value == null || value.signum() == 0;
    }
}
