package com.chambua.schoolsports.util;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Trimming and parsing helpers shared by the request validators.
 */
public final class FieldNormalizer {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private FieldNormalizer() {}

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public static boolean anyBlank(String... values) {
        for (String v : values) {
            if (isBlank(v)) return true;
        }
        return false;
    }

    public static String trim(String value) {
        return value == null ? null : value.trim();
    }

    /** Trimmed value, or null when blank. */
    public static String trimToNull(String value) {
        if (value == null) return null;
        String t = value.trim();
        return t.isEmpty() ? null : t;
    }

    public static boolean isValidEmail(String email) {
        return email != null && EMAIL.matcher(email).matches();
    }

    /** Parses a strictly positive integer; null for anything else. */
    public static Integer parsePositiveInt(String raw) {
        Integer n = parseInt(raw);
        return (n == null || n <= 0) ? null : n;
    }

    public static Integer parseInt(String raw) {
        if (isBlank(raw)) return null;
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /** ISO yyyy-MM-dd; a trailing time part (yyyy-MM-ddT...) is ignored. Null when unparseable. */
    public static LocalDate parseDate(String raw) {
        if (isBlank(raw)) return null;
        String t = raw.trim();
        if (t.length() > 10 && t.charAt(10) == 'T') t = t.substring(0, 10);
        try {
            return LocalDate.parse(t);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
