package com.medReports.facilityRecon.export;

import com.medReports.facilityRecon.extract.model.DischargeDisposition;
import com.medReports.facilityRecon.extract.model.PayerType;
import com.medReports.facilityRecon.reconcile.model.FacilityMetricsRow;
import com.medReports.facilityRecon.reconcile.model.ReconciliationSettings;
import com.medReports.facilityRecon.reconcile.model.ReportingCategory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;

/**
 * Ordered column list of the facility summary.
 *
 * Columns are only ever appended: the original summary columns first, then payer ratios and
 * gains, then category counts, then the "other" discharge columns, then one column per
 * configured CPT code. Adding a code to the configuration adds a column at the end.
 */
public final class MetricColumnSchema {

    private static final List<DischargeDisposition> REPORTED_DISPOSITIONS = List.of(
            DischargeDisposition.HOME_DISCHARGE, DischargeDisposition.HOSPITAL_TRANSFER, DischargeDisposition.EXPIRED);

    private final List<MetricColumn> columns;

    private MetricColumnSchema(List<MetricColumn> columns) {
        this.columns = List.copyOf(columns);
    }

    public static MetricColumnSchema forSettings(ReconciliationSettings settings) {
        List<MetricColumn> columns = new ArrayList<>();
        columns.add(new MetricColumn("Facility", FacilityMetricsRow::getFacilityName));
        columns.add(count("Patients Served", FacilityMetricsRow::getPatientsServed));
        columns.add(count("Total Visits", FacilityMetricsRow::getTotalVisits));
        columns.add(decimal("Avg Visits per Patient", FacilityMetricsRow::getAverageVisitsPerPatient));
        columns.add(decimal("LOS Overall Avg", FacilityMetricsRow::getAverageLengthOfStay));
        columns.add(decimal("LOS Man Avg", row -> row.payer(PayerType.MANAGED_CARE).getAverageLengthOfStay()));
        columns.add(decimal("LOS Med Avg", row -> row.payer(PayerType.MEDICARE_A).getAverageLengthOfStay()));
        for (DischargeDisposition disposition : REPORTED_DISPOSITIONS) {
            columns.add(new MetricColumn(disposition.getRatioColumn(), row -> row.getDischargeRatios().get(disposition)));
        }
        for (DischargeDisposition disposition : REPORTED_DISPOSITIONS) {
            columns.add(decimal(disposition.getPercentColumn(), row -> row.getDischargePercentages().get(disposition)));
        }
        for (PayerType payerType : PayerType.values()) {
            columns.add(new MetricColumn(payerType.getLabel() + " Ratio", row -> row.payer(payerType).getRatio()));
        }
        for (PayerType payerType : PayerType.values()) {
            columns.add(decimal("GG_Gain_" + payerType.getShortCode(), row -> row.payer(payerType).getAverageGain()));
        }
        columns.add(decimal("GG_Gain_Overall", FacilityMetricsRow::getOverallAverageGain));
        for (ReportingCategory category : settings.categories()) {
            columns.add(count(category.grossColumn(), row -> row.countsOf(category.name()).gross()));
            columns.add(count(category.uniqueColumn(), row -> row.countsOf(category.name()).uniquePatients()));
        }
        columns.add(new MetricColumn(DischargeDisposition.OTHER.getRatioColumn(),
                row -> row.getDischargeRatios().get(DischargeDisposition.OTHER)));
        columns.add(decimal(DischargeDisposition.OTHER.getPercentColumn(),
                row -> row.getDischargePercentages().get(DischargeDisposition.OTHER)));
        for (String code : settings.getReportedCptCodes()) {
            columns.add(count("CPT " + code, row -> row.getCptCodeCounts().getOrDefault(code, 0)));
        }
        return new MetricColumnSchema(columns);
    }

    public List<String> headers() {
        return columns.stream().map(MetricColumn::header).toList();
    }

    public List<String> render(FacilityMetricsRow row) {
        return columns.stream().map(column -> column.render(row)).toList();
    }

    private static MetricColumn count(String header, ToIntFunction<FacilityMetricsRow> value) {
        return new MetricColumn(header, row -> Integer.toString(value.applyAsInt(row)));
    }

    private static MetricColumn decimal(String header, ToDoubleFunction<FacilityMetricsRow> value) {
        return new MetricColumn(header, row -> BigDecimal.valueOf(value.applyAsDouble(row))
                .setScale(2, RoundingMode.HALF_UP)
                .toPlainString());
    }
}
