package com.medReports.facilityRecon.reconcile.model;

/**
 * States of one reconciliation run, in order. Each is reported once when reached.
 */
public enum RunStage {
    LOADED,
    NORMALIZED,
    MATCHED,
    DEDUPLICATED,
    AGGREGATED,
    EXPORTED
}
