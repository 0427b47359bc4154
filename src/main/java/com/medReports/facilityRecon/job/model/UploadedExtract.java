package com.medReports.facilityRecon.job.model;

import com.medReports.facilityRecon.extract.model.ExtractType;

/**
 * One uploaded file, read into memory before the job is queued.
 */
public record UploadedExtract(ExtractType type, String fileName, byte[] content) {
}
