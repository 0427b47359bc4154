package com.medReports.facilityRecon.reconcile.model;

import com.medReports.facilityRecon.extract.model.PayerType;
import lombok.Builder;
import lombok.Value;

/**
 * Metrics of the patients of one payer group within one facility.
 */
@Value
@Builder
public class PayerMetrics {

    PayerType payerType;

    int patientCount;

    /**
     * {@code patientCount:patientsServed}, "0:0" for a facility without patients.
     */
    String ratio;

    /**
     * Average functional gain over patients with both scores; 0 when none has them.
     */
    double averageGain;

    int gainPatientCount;

    double averageLengthOfStay;
}
