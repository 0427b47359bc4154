package com.medReports.facilityRecon.reconcile.matcher;

import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.reconcile.model.MatchRule;

/**
 * Exact id equality, only between records of the same identifier scheme.
 */
public class PatientIdMatchStrategy implements MatchStrategy {

    @Override
    public MatchRule rule() {
        return MatchRule.PATIENT_ID;
    }

    @Override
    public boolean matches(PatientRecord a, PatientRecord b) {
        return a.hasPatientId() && b.hasPatientId()
                && a.getIdentifierScheme().equals(b.getIdentifierScheme())
                && a.getPatientId().trim().equalsIgnoreCase(b.getPatientId().trim());
    }
}
