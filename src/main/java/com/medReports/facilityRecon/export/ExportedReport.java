package com.medReports.facilityRecon.export;

/**
 * Rendered artifacts of one run.
 *
 * @param summaryCsv Facility summary, one line per facility
 * @param allPatientsCsv Listing of every matched patient
 */
public record ExportedReport(String summaryCsv, String allPatientsCsv) {
}
