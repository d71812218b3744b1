package com.envelope.backend.services.overview;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.regex.Pattern;

/**
 * Calendar-month helpers. A period is a {@link YearMonth}; its wire form is "YYYY-MM".
 */
public final class Periods {

    private static final Pattern PERIOD_PATTERN = Pattern.compile("^\\d{4}-(0[1-9]|1[0-2])$");

    private Periods() {
    }

    public static boolean isValid(String raw) {
        return raw != null && PERIOD_PATTERN.matcher(raw).matches();
    }

    /**
     * Parses a "YYYY-MM" period. Callers at the API edge should check {@link #isValid(String)} first.
     */
    public static YearMonth parse(String raw) {
        return YearMonth.parse(raw);
    }

    public static String format(YearMonth period) {
        return period.toString();
    }

    /** First day of the month, inclusive. */
    public static LocalDate start(YearMonth period) {
        return period.atDay(1);
    }

    /** First day of the following month, exclusive. */
    public static LocalDate endExclusive(YearMonth period) {
        return period.plusMonths(1).atDay(1);
    }
}
