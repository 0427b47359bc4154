package com.medReports.facilityRecon.reconcile.model;

import com.medReports.facilityRecon.export.ExportedReport;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of a completed run. Only produced when every stage succeeded.
 */
@Value
@Builder
public class ReconciliationResult {

    String runId;

    /**
     * One row per facility, ordered by facility key.
     */
    List<FacilityMetricsRow> rows;

    List<PatientSummaryRow> patients;

    List<ReconciliationIssue> issues;

    ExportedReport report;
}
