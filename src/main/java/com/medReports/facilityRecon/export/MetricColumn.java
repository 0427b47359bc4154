package com.medReports.facilityRecon.export;

import com.medReports.facilityRecon.reconcile.model.FacilityMetricsRow;

import java.util.function.Function;

/**
 * One summary column: its header and how a row renders into it.
 */
public record MetricColumn(String header, Function<FacilityMetricsRow, String> value) {

    public String render(FacilityMetricsRow row) {
        return value.apply(row);
    }
}
