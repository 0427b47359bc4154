package com.medReports.facilityRecon.config;

import com.medReports.facilityRecon.reconcile.model.ReconciliationSettings;
import com.medReports.facilityRecon.reconcile.model.ReportingPeriod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Reconciliation settings read from application properties.
 *
 * Every run gets its own {@link ReconciliationSettings} value from {@link #newSettings()}.
 */
@Slf4j
@Component
public class ReconciliationConfig {

    @Value("${recon.matching.last-name-prefix-length:3}")
    private int lastNamePrefixLength;

    @Value("${recon.category.long-term-care.pos-code:32}")
    private String longTermCarePosCode;

    @Value("${recon.category.injection.cpt-codes:20600,20604,20605,20606,20610,20611}")
    private String[] injectionCptCodes;

    @Value("${recon.cpt-codes:20600,20605,20610,99309,99310}")
    private String[] reportedCptCodes;

    @Value("${recon.facilities.known:}")
    private String[] knownFacilities;

    @Value("${recon.reporting-period:MONTH}")
    private String reportingPeriod;

    @Value("${recon.pipeline.parallelism:4}")
    private int parallelism;

    public ReconciliationSettings newSettings() {
        return ReconciliationSettings.builder()
                .lastNamePrefixLength(lastNamePrefixLength)
                .longTermCarePosCode(longTermCarePosCode.trim())
                .injectionCptCodes(clean(injectionCptCodes))
                .reportedCptCodes(clean(reportedCptCodes))
                .knownFacilities(clean(knownFacilities))
                .reportingPeriod(ReportingPeriod.valueOf(reportingPeriod.trim().toUpperCase(Locale.ROOT)))
                .parallelism(Math.max(1, parallelism))
                .build();
    }

    private static List<String> clean(String[] values) {
        if (values == null) {
            return List.of();
        }
        return Arrays.stream(values)
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .distinct()
                .toList();
    }
}
