package com.medReports.facilityRecon.reconcile.exception;

/**
 * Exception thrown when a run has no extract with any usable record.
 */
public class NoUsableExtractException extends RuntimeException {

    public NoUsableExtractException(String message) {
        super(message);
    }
}
