package com.medReports.facilityRecon.reconcile.matcher;

import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.extract.util.PatientNames;
import com.medReports.facilityRecon.reconcile.model.MatchRule;

/**
 * Case-insensitive equality of first and last name.
 */
public class ExactNameMatchStrategy implements MatchStrategy {

    @Override
    public MatchRule rule() {
        return MatchRule.EXACT_NAME;
    }

    @Override
    public boolean matches(PatientRecord a, PatientRecord b) {
        String firstA = PatientNames.normalize(a.getFirstName());
        String lastA = PatientNames.normalize(a.getLastName());
        if (firstA.isEmpty() || lastA.isEmpty()) {
            return false;
        }
        return firstA.equals(PatientNames.normalize(b.getFirstName()))
                && lastA.equals(PatientNames.normalize(b.getLastName()))
                && !MatchStrategy.conflictingIds(a, b);
    }
}
