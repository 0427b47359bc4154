package com.medReports.facilityRecon.reconcile.model;

import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.extract.util.CptCodes;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A named encounter filter reported as a gross and a unique-patient count.
 *
 * @param name Stable identifier, e.g. "long-term-care"
 * @param label Column label prefix, e.g. "LTC Encounters"
 * @param filter Qualifying-record predicate
 */
public record ReportingCategory(String name, String label, Predicate<PatientRecord> filter) {

    public static ReportingCategory placeOfService(String name, String label, String posCode) {
        String expected = posCode.trim();
        return new ReportingCategory(name, label,
                r -> r.getPlaceOfServiceCode() != null && r.getPlaceOfServiceCode().trim().equals(expected));
    }

    public static ReportingCategory anyCptCode(String name, String label, Collection<String> codes) {
        Set<String> expected = codes.stream()
                .map(c -> c.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        return new ReportingCategory(name, label,
                r -> CptCodes.codesOf(r).stream().anyMatch(expected::contains));
    }

    public String grossColumn() {
        return label + " Gross";
    }

    public String uniqueColumn() {
        return label + " Unique Patients";
    }
}
