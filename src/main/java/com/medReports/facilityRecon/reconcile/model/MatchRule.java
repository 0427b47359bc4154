package com.medReports.facilityRecon.reconcile.model;

/**
 * Rule that joined two records into one identity, strongest first.
 */
public enum MatchRule {
    PATIENT_ID,
    EXACT_NAME,
    PARTIAL_NAME
}
