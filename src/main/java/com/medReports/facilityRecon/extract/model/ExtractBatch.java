package com.medReports.facilityRecon.extract.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * All records of one uploaded extract file.
 */
@Value
@Builder(toBuilder = true)
public class ExtractBatch {

    String batchId;

    ExtractType extractType;

    String fileName;

    @Builder.Default
    List<PatientRecord> records = List.of();

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
