package com.medReports.facilityRecon.reconcile.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable configuration handed to one reconciliation run.
 */
@Value
@Builder
public class ReconciliationSettings {

    public static final String LONG_TERM_CARE = "long-term-care";
    public static final String INJECTION = "injection";

    @Builder.Default
    int lastNamePrefixLength = 3;

    @Builder.Default
    String longTermCarePosCode = "32";

    @Builder.Default
    List<String> injectionCptCodes = List.of("20600", "20604", "20605", "20606", "20610", "20611");

    /**
     * Codes reported one column each, in this order.
     */
    @Builder.Default
    List<String> reportedCptCodes = List.of("20600", "20605", "20610", "99309", "99310");

    @Builder.Default
    List<String> knownFacilities = List.of();

    @Builder.Default
    ReportingPeriod reportingPeriod = ReportingPeriod.MONTH;

    @Builder.Default
    int parallelism = 4;

    /**
     * The reporting categories, in column order. The set is fixed; only filter values are configurable.
     */
    public List<ReportingCategory> categories() {
        return List.of(
                ReportingCategory.placeOfService(LONG_TERM_CARE, "LTC Encounters", longTermCarePosCode),
                ReportingCategory.anyCptCode(INJECTION, "Injection Encounters", injectionCptCodes));
    }
}
