package com.medReports.facilityRecon.extract.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Comparison forms of patient names.
 */
public final class PatientNames {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

    private PatientNames() {
    }

    /**
     * Trimmed, lower-cased, single-spaced name. Null becomes the empty string.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return WHITESPACE.matcher(name.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    /**
     * First {@code length} letters of a surname, ignoring spaces, hyphens and apostrophes.
     * Shorter surnames are returned whole.
     */
    public static String surnamePrefix(String lastName, int length) {
        String compact = NON_ALPHANUMERIC.matcher(normalize(lastName)).replaceAll("");
        return compact.length() <= length ? compact : compact.substring(0, length);
    }

    /**
     * Splits a "Last, First" name. A value without a comma is taken as the last name.
     *
     * @return two-element array of first and last name
     */
    public static String[] splitFullName(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            return new String[]{"", ""};
        }
        String cleaned = fullName.trim().replace("\"", "");
        int comma = cleaned.indexOf(',');
        if (comma < 0) {
            return new String[]{"", cleaned.trim()};
        }
        return new String[]{cleaned.substring(comma + 1).trim(), cleaned.substring(0, comma).trim()};
    }
}
