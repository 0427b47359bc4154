package com.medReports.facilityRecon.job.exception;

/**
 * Exception thrown when no job exists for a job id (unknown or expired).
 */
public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String message) {
        super(message);
    }
}
