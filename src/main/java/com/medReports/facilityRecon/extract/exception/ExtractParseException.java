package com.medReports.facilityRecon.extract.exception;

/**
 * Exception thrown when an uploaded extract cannot be read at all.
 */
public class ExtractParseException extends RuntimeException {

    public ExtractParseException(String message) {
        super(message);
    }

    public ExtractParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
