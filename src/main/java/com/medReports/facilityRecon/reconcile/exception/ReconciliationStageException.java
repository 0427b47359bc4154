package com.medReports.facilityRecon.reconcile.exception;

import com.medReports.facilityRecon.reconcile.model.RunStage;

/**
 * Exception thrown when a run fails while reaching a stage. Names the facility and extracts
 * being processed; the run is aborted and nothing is exported.
 */
public class ReconciliationStageException extends RuntimeException {

    private final RunStage stage;
    private final String facility;
    private final String extract;

    public ReconciliationStageException(RunStage stage, String facility, String extract, Throwable cause) {
        super("Reconciliation failed before " + stage + " - facility: " + facility + ", extract: " + extract
                + (cause.getMessage() != null ? " - " + cause.getMessage() : ""), cause);
        this.stage = stage;
        this.facility = facility;
        this.extract = extract;
    }

    public RunStage getStage() {
        return stage;
    }

    public String getFacility() {
        return facility;
    }

    public String getExtract() {
        return extract;
    }
}
