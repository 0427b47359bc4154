package com.medReports.facilityRecon.reconcile.model;

import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.facility.model.FacilityKey;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One patient in one facility in one reporting period, counted once however many batches mention it.
 */
@Value
@Builder
public class DeduplicatedEncounter {

    FacilityKey facilityKey;

    String identityId;

    /**
     * Reporting-period bucket of the encounter date, e.g. "2025-07", or "undated".
     */
    String period;

    /**
     * Qualifying source rows folded into this encounter, in batch order.
     */
    List<PatientRecord> sourceRecords;
}
