package com.medReports.facilityRecon.reconcile.model;

import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.facility.model.FacilityKey;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The matched identities of one facility across all of its batches.
 */
public class IdentityResolution {

    private final FacilityKey facilityKey;
    private final List<MatchedIdentity> identities;
    private final Map<String, MatchedIdentity> byRecordId = new HashMap<>();

    public IdentityResolution(FacilityKey facilityKey, List<MatchedIdentity> identities) {
        this.facilityKey = facilityKey;
        this.identities = List.copyOf(identities);
        for (MatchedIdentity identity : this.identities) {
            for (PatientRecord record : identity.getRecords()) {
                byRecordId.put(record.getRecordId(), identity);
            }
        }
    }

    public FacilityKey getFacilityKey() {
        return facilityKey;
    }

    public List<MatchedIdentity> getIdentities() {
        return identities;
    }

    /**
     * @return The identity holding the record, or null for a record that was not resolved here
     */
    public MatchedIdentity identityOf(PatientRecord record) {
        return byRecordId.get(record.getRecordId());
    }

    public int size() {
        return identities.size();
    }
}
