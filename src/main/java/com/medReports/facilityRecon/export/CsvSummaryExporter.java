package com.medReports.facilityRecon.export;

import com.medReports.facilityRecon.reconcile.model.FacilityMetricsRow;
import com.medReports.facilityRecon.reconcile.model.PatientSummaryRow;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Renders the facility summary and the all-patients listing as CSV.
 */
@Slf4j
@Service
public class CsvSummaryExporter implements MetricsExporter {

    static final String[] PATIENT_HEADERS = {
            "Facility", "First Name", "Last Name", "Payer", "LOS", "Visits", "Seen by Provider"
    };

    @Override
    public ExportedReport export(MetricColumnSchema schema, List<FacilityMetricsRow> rows, List<PatientSummaryRow> patients) {
        String summary = write(schema.headers().toArray(String[]::new), printer -> {
            for (FacilityMetricsRow row : rows) {
                printer.printRecord(schema.render(row));
            }
        });
        String allPatients = write(PATIENT_HEADERS, printer -> {
            for (PatientSummaryRow patient : patients) {
                printer.printRecord(
                        patient.getFacilityName(),
                        patient.getFirstName(),
                        patient.getLastName(),
                        patient.getPayer(),
                        patient.getLengthOfStayDays() == null ? "" : patient.getLengthOfStayDays().toString(),
                        Integer.toString(patient.getVisitCount()),
                        patient.isSeenByProvider() ? "Yes" : "No");
            }
        });
        log.debug("Report exported - facilities: {}, patients: {}", rows.size(), patients.size());
        return new ExportedReport(summary, allPatients);
    }

    private static String write(String[] headers, RecordWriter body) {
        StringWriter out = new StringWriter();
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(headers)
                .build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            body.write(printer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render CSV", e);
        }
        return out.toString();
    }

    @FunctionalInterface
    private interface RecordWriter {
        void write(CSVPrinter printer) throws IOException;
    }
}
