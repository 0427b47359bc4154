package com.medReports.facilityRecon.reconcile.model;

/**
 * Non-fatal conditions accumulated during a run and returned with its result.
 */
public enum IssueType {

    /**
     * A record lacks a field a metric needs; it is left out of that metric.
     */
    MALFORMED_RECORD,

    /**
     * A label normalized to a facility outside the configured list; it stays a singleton facility.
     */
    UNRESOLVED_FACILITY,

    /**
     * A partial-name match had more than one candidate; the first candidate was taken.
     */
    AMBIGUOUS_MATCH,

    /**
     * An extract carried no records.
     */
    EMPTY_EXTRACT,

    /**
     * A record from another facility reached the matcher and was discarded.
     */
    CROSS_FACILITY_MATCH_ATTEMPT
}
