package com.medReports.facilityRecon.job.exception;

/**
 * Exception thrown when an artifact is requested before its job completed.
 */
public class ArtifactNotReadyException extends RuntimeException {

    public ArtifactNotReadyException(String message) {
        super(message);
    }
}
