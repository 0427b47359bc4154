package com.medReports.facilityRecon.job.exception;

/**
 * Exception thrown when an uploaded file cannot be read from the request.
 */
public class UnreadableUploadException extends RuntimeException {

    public UnreadableUploadException(String message, Throwable cause) {
        super(message, cause);
    }
}
