package com.medReports.facilityRecon.reconcile.model;

import com.medReports.facilityRecon.extract.model.ExtractType;
import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.facility.model.FacilityKey;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Records believed to denote one patient within one facility.
 */
@Value
@Builder
public class MatchedIdentity {

    String identityId;

    FacilityKey facilityKey;

    /**
     * Member records in source order; the first one names the patient.
     */
    List<PatientRecord> records;

    /**
     * Rules that joined the members; empty for a singleton.
     */
    Set<MatchRule> rules;

    public PatientRecord getPrimaryRecord() {
        return records.get(0);
    }

    public boolean isSingleton() {
        return records.size() == 1;
    }

    public List<PatientRecord> recordsOf(ExtractType type) {
        return records.stream()
                .filter(r -> r.getExtractType() == type)
                .toList();
    }
}
