package com.ledger.engine.util;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lenient parsing of trigger comparison values. Every method returns null instead of
 * throwing, so malformed rule data makes a trigger evaluate to false.
 */
public final class ValueParsers {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd/MM/yyyy"),
            DateTimeFormatter.ofPattern("dd-MM-yyyy"));

    // "1,000" or "12,345,678": a comma grouping thousands or a decimal comma, no way to tell.
    private static final Pattern COMMA_GROUPED = Pattern.compile("-?\\d{1,3}(,\\d{3})+");

    private ValueParsers() {
    }

    /**
     * Parses a decimal, accepting a comma as decimal separator ("12,50") and a leading
     * currency sign. Values whose comma may group thousands ("1,000") are rejected, see
     * {@link #isAmbiguousDecimal(String)}.
     */
    public static BigDecimal parseDecimal(String raw) {
        String cleaned = clean(raw);
        if (cleaned == null || COMMA_GROUPED.matcher(cleaned).matches()) {
            return null;
        }
        if (cleaned.indexOf(',') >= 0 && cleaned.indexOf('.') < 0) {
            cleaned = cleaned.replace(',', '.');
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Whether the value reads both as a decimal comma and as thousands grouping, like
     * {@code "1,000"}.
     */
    public static boolean isAmbiguousDecimal(String raw) {
        String cleaned = clean(raw);
        return cleaned != null && COMMA_GROUPED.matcher(cleaned).matches();
    }

    private static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.trim().replace("€", "").replace("$", "").replace(" ", "");
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * Parses a day from {@code yyyy-MM-dd}, {@code dd/MM/yyyy}, {@code dd-MM-yyyy} or an ISO
     * date-time (time part dropped).
     */
    public static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate parsed = tryParse(value, format);
            if (parsed != null) {
                return parsed;
            }
        }
        LocalDate offsetDate = tryParse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        return offsetDate != null ? offsetDate : tryParse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    private static LocalDate tryParse(String value, DateTimeFormatter format) {
        try {
            return LocalDate.from(format.parse(value));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Splits a range value {@code low..high} into its two trimmed bounds.
     *
     * @return a two-element array, or null when the separator is missing or a bound is blank
     */
    public static String[] splitRange(String raw, String separator) {
        if (raw == null) {
            return null;
        }
        int index = raw.indexOf(separator);
        if (index < 0) {
            return null;
        }
        String low = raw.substring(0, index).trim();
        String high = raw.substring(index + separator.length()).trim();
        if (low.isEmpty() || high.isEmpty()) {
            return null;
        }
        return new String[]{low, high};
    }
}
