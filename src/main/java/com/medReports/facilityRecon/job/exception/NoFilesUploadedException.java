package com.medReports.facilityRecon.job.exception;

/**
 * Exception thrown when an upload request carries no file.
 */
public class NoFilesUploadedException extends RuntimeException {

    public NoFilesUploadedException(String message) {
        super(message);
    }
}
