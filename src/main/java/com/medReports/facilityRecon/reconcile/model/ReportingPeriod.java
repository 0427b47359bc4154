package com.medReports.facilityRecon.reconcile.model;

import java.time.LocalDate;

/**
 * Granularity of the encounter-date bucket in the deduplication key.
 */
public enum ReportingPeriod {
    MONTH,
    QUARTER;

    public static final String UNDATED = "undated";

    public String bucket(LocalDate date) {
        if (date == null) {
            return UNDATED;
        }
        if (this == MONTH) {
            return String.format("%d-%02d", date.getYear(), date.getMonthValue());
        }
        return date.getYear() + "-Q" + ((date.getMonthValue() - 1) / 3 + 1);
    }
}
