package com.medReports.facilityRecon.reconcile.model;

import com.medReports.facilityRecon.extract.model.DischargeDisposition;
import com.medReports.facilityRecon.extract.model.PayerType;
import com.medReports.facilityRecon.facility.model.FacilityKey;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Aggregated metrics of one facility for one run. Built once and never changed.
 *
 * Every map holds an entry for each configured key (category, CPT code, payer type,
 * disposition), zero where nothing qualified.
 */
@Value
@Builder
public class FacilityMetricsRow {

    FacilityKey facilityKey;

    String facilityName;

    /**
     * Distinct matched identities in the facility; the denominator of every ratio.
     */
    int patientsServed;

    int totalVisits;

    double averageVisitsPerPatient;

    double averageLengthOfStay;

    /**
     * Counts by reporting category name, in category order.
     */
    Map<String, EncounterCounts> categoryCounts;

    /**
     * Gross counts by CPT code, in configured code order.
     */
    Map<String, Integer> cptCodeCounts;

    Map<PayerType, PayerMetrics> payerMetrics;

    /**
     * Average gain across all patients with both scores, whatever their payer.
     */
    double overallAverageGain;

    int overallGainPatientCount;

    Map<DischargeDisposition, Integer> dischargeCounts;

    Map<DischargeDisposition, String> dischargeRatios;

    Map<DischargeDisposition, Double> dischargePercentages;

    public EncounterCounts countsOf(String category) {
        return categoryCounts.getOrDefault(category, EncounterCounts.ZERO);
    }

    public PayerMetrics payer(PayerType payerType) {
        return payerMetrics.get(payerType);
    }
}
