package com.shinmonzen.backend.services.invoices.util;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class InvoiceDates {

    private static final Pattern HEADER_YEAR_MONTH = Pattern.compile("(\\d{4})\\s*年\\s*(\\d{1,2})\\s*月");

    private static final List<Pattern> FULL_DATE_PATTERNS = List.of(
            // 2025-10-09, 2025/10/09, 2025.10.09
            Pattern.compile("^(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})"),
            // 2025年10月9日
            Pattern.compile("^(\\d{4})\\s*年\\s*(\\d{1,2})\\s*月\\s*(\\d{1,2})\\s*日")
    );

    // 25/10/09
    private static final Pattern SHORT_YEAR_DATE = Pattern.compile("^(\\d{2})/(\\d{1,2})/(\\d{1,2})$");

    private InvoiceDates() {
    }

    /**
     * Document-level "yyyy年M月" header, e.g. "2025年10月31日 締切分" -> 2025-10.
     */
    public static YearMonth headerYearMonth(String text) {
        if (text == null || text.isBlank()) return null;
        Matcher m = HEADER_YEAR_MONTH.matcher(NormalizeUtil.toHalfWidth(text));
        if (!m.find()) return null;
        return yearMonthOrNull(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }

    /**
     * Lenient date parsing for model output and spreadsheet cells.
     */
    public static LocalDate parseFlexible(String value) {
        if (value == null) return null;
        String v = NormalizeUtil.toHalfWidth(value).trim();
        if (v.isEmpty()) return null;

        for (Pattern p : FULL_DATE_PATTERNS) {
            Matcher m = p.matcher(v);
            if (m.find()) {
                return dateOrNull(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
            }
        }

        Matcher shortMatcher = SHORT_YEAR_DATE.matcher(v);
        if (shortMatcher.find()) {
            return dateOrNull(2000 + Integer.parseInt(shortMatcher.group(1)),
                    Integer.parseInt(shortMatcher.group(2)),
                    Integer.parseInt(shortMatcher.group(3)));
        }

        return null;
    }

    public static LocalDate parseObject(Object value) {
        if (value == null) return null;
        if (value instanceof LocalDate d) return d;
        if (value instanceof LocalDateTime dt) return dt.toLocalDate();
        return parseFlexible(value.toString());
    }

    public static LocalDate firstOfCurrentMonth(Clock clock) {
        return LocalDate.now(clock).withDayOfMonth(1);
    }

    public static LocalDate dateOrNull(int year, int month, int day) {
        try {
            return LocalDate.of(year, month, day);
        } catch (Exception e) {
            return null;
        }
    }

    private static YearMonth yearMonthOrNull(int year, int month) {
        try {
            return YearMonth.of(year, month);
        } catch (Exception e) {
            return null;
        }
    }
}
