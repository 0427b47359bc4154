package com.medReports.facilityRecon.reconcile.model;

import lombok.Builder;
import lombok.Value;

/**
 * One matched patient in the all-patients listing.
 */
@Value
@Builder
public class PatientSummaryRow {

    String facilityName;

    String identityId;

    String firstName;

    String lastName;

    /**
     * Payer labels joined with "/", empty when unclassified.
     */
    String payer;

    /**
     * Null when no length-of-stay record carried days.
     */
    Integer lengthOfStayDays;

    int visitCount;

    boolean seenByProvider;
}
