package com.medReports.facilityRecon.job.model;

public enum JobStatus {
    UPLOADED,
    PROCESSING,
    COMPLETED,
    ERROR
}
