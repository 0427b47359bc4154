package com.medReports.facilityRecon.reconcile.model;

/**
 * Gross and unique-patient counts of one reporting category.
 */
public record EncounterCounts(int gross, int uniquePatients) {

    public static final EncounterCounts ZERO = new EncounterCounts(0, 0);

    public static EncounterCounts of(DeduplicatedEncounterSet set) {
        return new EncounterCounts(set.getGrossCount(), set.getUniquePatientCount());
    }
}
