package com.medReports.facilityRecon.reconcile.matcher;

import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.reconcile.model.MatchRule;

/**
 * One tier of the identity matching cascade.
 *
 * Strategies are tried in order; the first one that accepts a pair decides it.
 */
public interface MatchStrategy {

    MatchRule rule();

    boolean matches(PatientRecord a, PatientRecord b);

    /**
     * Two records carrying different ids in the same identifier scheme are different patients,
     * whatever their names say.
     */
    static boolean conflictingIds(PatientRecord a, PatientRecord b) {
        return a.hasPatientId() && b.hasPatientId()
                && a.getIdentifierScheme().equals(b.getIdentifierScheme())
                && !a.getPatientId().trim().equalsIgnoreCase(b.getPatientId().trim());
    }
}
