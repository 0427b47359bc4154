package com.medReports.facilityRecon.export;

import com.medReports.facilityRecon.reconcile.model.FacilityMetricsRow;
import com.medReports.facilityRecon.reconcile.model.PatientSummaryRow;

import java.util.List;

/**
 * Renders the rows of a finished run. Implementations must populate every schema column.
 */
public interface MetricsExporter {

    ExportedReport export(MetricColumnSchema schema, List<FacilityMetricsRow> rows, List<PatientSummaryRow> patients);
}
