package com.medReports.facilityRecon.reconcile.matcher;

import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.extract.util.PatientNames;
import com.medReports.facilityRecon.reconcile.model.MatchRule;

/**
 * Exact first name plus equal surname prefix, e.g. "Mary Johnson" and "Mary Johnston" with a prefix of 3.
 *
 * Spaces, hyphens and apostrophes are ignored when taking the prefix, so "O'Neil" and "ONeill" agree.
 */
public class PartialNameMatchStrategy implements MatchStrategy {

    private final int prefixLength;

    public PartialNameMatchStrategy(int prefixLength) {
        if (prefixLength < 1) {
            throw new IllegalArgumentException("Surname prefix length must be positive: " + prefixLength);
        }
        this.prefixLength = prefixLength;
    }

    @Override
    public MatchRule rule() {
        return MatchRule.PARTIAL_NAME;
    }

    @Override
    public boolean matches(PatientRecord a, PatientRecord b) {
        String firstA = PatientNames.normalize(a.getFirstName());
        String prefixA = PatientNames.surnamePrefix(a.getLastName(), prefixLength);
        if (firstA.isEmpty() || prefixA.isEmpty()) {
            return false;
        }
        return firstA.equals(PatientNames.normalize(b.getFirstName()))
                && prefixA.equals(PatientNames.surnamePrefix(b.getLastName(), prefixLength))
                && !MatchStrategy.conflictingIds(a, b);
    }
}
