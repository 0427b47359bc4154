package com.medReports.facilityRecon.reconcile.model;

import com.medReports.facilityRecon.extract.model.ExtractType;
import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.facility.model.FacilityKey;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything the aggregator needs about one facility: its records by batch, the identities
 * resolved across them and the deduplicated encounters of every reporting category.
 */
@Value
@Builder
public class ReconciledRecordSet {

    FacilityKey facilityKey;

    String facilityName;

    /**
     * Records of this facility, one list per uploaded batch, in upload order.
     */
    List<List<PatientRecord>> batches;

    IdentityResolution identities;

    /**
     * Deduplicated encounters keyed by reporting category name.
     */
    Map<String, DeduplicatedEncounterSet> categoryEncounters;

    public List<PatientRecord> recordsOf(ExtractType type) {
        return batches.stream()
                .flatMap(List::stream)
                .filter(r -> r.getExtractType() == type)
                .toList();
    }

    public DeduplicatedEncounterSet encountersOf(String category) {
        return categoryEncounters.getOrDefault(category, DeduplicatedEncounterSet.empty());
    }
}
