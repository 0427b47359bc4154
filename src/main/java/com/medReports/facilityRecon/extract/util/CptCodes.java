package com.medReports.facilityRecon.extract.util;

import com.medReports.facilityRecon.extract.model.PatientRecord;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsing of multi-valued procedure code fields such as {@code "20600,20610"}.
 */
public final class CptCodes {

    private static final Pattern DELIMITERS = Pattern.compile("[,;|\\s]+");

    private CptCodes() {
    }

    /**
     * Splits a code field into distinct codes in field order. A modifier suffix ("20610-RT") is dropped.
     */
    public static List<String> parse(String field) {
        if (field == null || field.isBlank()) {
            return List.of();
        }
        Set<String> codes = new LinkedHashSet<>();
        Arrays.stream(DELIMITERS.split(field.trim()))
                .map(CptCodes::baseCode)
                .filter(code -> !code.isEmpty())
                .forEach(codes::add);
        return List.copyOf(codes);
    }

    /**
     * Distinct codes of a record, re-splitting any element that still holds a delimited list.
     */
    public static Set<String> codesOf(PatientRecord record) {
        Set<String> codes = new LinkedHashSet<>();
        for (String element : record.getCptCodes()) {
            codes.addAll(parse(element));
        }
        return codes;
    }

    private static String baseCode(String token) {
        int modifier = token.indexOf('-');
        String code = modifier > 0 ? token.substring(0, modifier) : token;
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
