package com.medReports.facilityRecon.reconcile.model;

import lombok.Value;

import java.util.List;

/**
 * Gross and unique-patient view of the qualifying encounters of one facility.
 *
 * Both counts are computed from the same input and are zero, never absent, when nothing qualifies.
 */
@Value
public class DeduplicatedEncounterSet {

    private static final DeduplicatedEncounterSet EMPTY = new DeduplicatedEncounterSet(0, 0, List.of());

    /**
     * Qualifying rows across all batches, not deduplicated.
     */
    int grossCount;

    /**
     * Distinct matched identities among the qualifying rows.
     */
    int uniquePatientCount;

    List<DeduplicatedEncounter> encounters;

    public static DeduplicatedEncounterSet empty() {
        return EMPTY;
    }
}
