package com.medReports.facilityRecon.reconcile.matcher;

import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.extract.util.PatientNameMasker;
import com.medReports.facilityRecon.facility.model.FacilityKey;
import com.medReports.facilityRecon.reconcile.model.IssueLog;
import com.medReports.facilityRecon.reconcile.model.IssueType;
import com.medReports.facilityRecon.reconcile.model.MatchRule;
import com.medReports.facilityRecon.reconcile.model.MatchedIdentity;
import com.medReports.facilityRecon.reconcile.model.ReconciliationIssue;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pairs records of two extracts that lack a shared primary key.
 *
 * Strategies run as separate passes in priority order. Within a pass, each unconsumed record
 * of source A takes the first unconsumed record of source B the strategy accepts, so every
 * record is consumed at most once and the output depends only on input order.
 */
@Slf4j
public class PatientIdentityMatcher {

    private final List<MatchStrategy> strategies;

    public PatientIdentityMatcher(List<MatchStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Patient id, then exact name, then first name plus surname prefix.
     */
    public static PatientIdentityMatcher standard(int lastNamePrefixLength) {
        return new PatientIdentityMatcher(List.of(
                new PatientIdMatchStrategy(),
                new ExactNameMatchStrategy(),
                new PartialNameMatchStrategy(lastNamePrefixLength)));
    }

    public List<MatchStrategy> getStrategies() {
        return strategies;
    }

    /**
     * Matches two record sets of one facility; issues are logged but not returned.
     */
    public List<MatchedIdentity> match(List<PatientRecord> sourceA, List<PatientRecord> sourceB, FacilityKey facility) {
        return match(sourceA, sourceB, facility, new IssueLog("standalone"));
    }

    /**
     * Matches two record sets of one facility into identities.
     *
     * Matched pairs come first in source-A order, followed by unmatched source-B records as
     * singletons. Records of any other facility are discarded and reported.
     *
     * @param sourceA Records of the first extract
     * @param sourceB Records of the second extract
     * @param facility Facility being reconciled
     * @param issues Issue log of the current run
     * @return Identities covering every accepted record exactly once
     */
    public List<MatchedIdentity> match(List<PatientRecord> sourceA, List<PatientRecord> sourceB,
                                       FacilityKey facility, IssueLog issues) {
        Pairing pairing = pair(sourceA, sourceB, facility, issues);

        Map<PatientRecord, MatchedPair> pairsByA = new IdentityHashMap<>();
        Map<PatientRecord, MatchedPair> pairsByB = new IdentityHashMap<>();
        for (MatchedPair matched : pairing.pairs()) {
            pairsByA.put(matched.a(), matched);
            pairsByB.put(matched.b(), matched);
        }

        List<MatchedIdentity> identities = new ArrayList<>();
        for (PatientRecord a : pairing.acceptedA()) {
            MatchedPair matched = pairsByA.get(a);
            if (matched != null) {
                identities.add(identity(facility, identities.size() + 1, List.of(a, matched.b()), Set.of(matched.rule())));
            } else {
                identities.add(identity(facility, identities.size() + 1, List.of(a), Set.of()));
            }
        }
        for (PatientRecord b : pairing.acceptedB()) {
            if (!pairsByB.containsKey(b)) {
                identities.add(identity(facility, identities.size() + 1, List.of(b), Set.of()));
            }
        }
        return identities;
    }

    /**
     * Runs the matching cascade and returns the accepted pairs.
     */
    public Pairing pair(List<PatientRecord> sourceA, List<PatientRecord> sourceB,
                        FacilityKey facility, IssueLog issues) {
        List<PatientRecord> acceptedA = sameFacility(sourceA, facility, issues);
        List<PatientRecord> acceptedB = sameFacility(sourceB, facility, issues);

        List<MatchedPair> pairs = new ArrayList<>();
        for (GroupPair matched : cascade(singletons(acceptedA), singletons(acceptedB), facility, issues)) {
            pairs.add(matched.via());
        }
        return new Pairing(acceptedA, acceptedB, pairs);
    }

    /**
     * Runs the matching cascade over groups of records already known to be one patient each.
     *
     * Two groups match under a rule when any member of one matches any member of the other.
     * Each group is consumed at most once. Records are expected to belong to the facility.
     *
     * @return Matched group indexes with the member pair that joined them
     */
    public List<GroupPair> pairGroups(List<List<PatientRecord>> groupsA, List<List<PatientRecord>> groupsB,
                                      FacilityKey facility, IssueLog issues) {
        return cascade(groupsA, groupsB, facility, issues);
    }

    private List<GroupPair> cascade(List<List<PatientRecord>> groupsA, List<List<PatientRecord>> groupsB,
                                    FacilityKey facility, IssueLog issues) {
        boolean[] consumedA = new boolean[groupsA.size()];
        boolean[] consumedB = new boolean[groupsB.size()];
        List<GroupPair> pairs = new ArrayList<>();

        for (MatchStrategy strategy : strategies) {
            boolean countCandidates = strategy.rule() == MatchRule.PARTIAL_NAME;
            for (int i = 0; i < groupsA.size(); i++) {
                if (consumedA[i]) {
                    continue;
                }
                int chosen = -1;
                MatchedPair via = null;
                int candidates = 0;
                for (int j = 0; j < groupsB.size(); j++) {
                    if (consumedB[j]) {
                        continue;
                    }
                    MatchedPair found = firstMatch(strategy, groupsA.get(i), groupsB.get(j));
                    if (found == null) {
                        continue;
                    }
                    candidates++;
                    if (chosen < 0) {
                        chosen = j;
                        via = found;
                    }
                    if (!countCandidates) {
                        break;
                    }
                }
                if (chosen < 0) {
                    continue;
                }

                consumedA[i] = true;
                consumedB[chosen] = true;
                pairs.add(new GroupPair(i, chosen, via));

                if (countCandidates) {
                    logPartialMatch(via.a(), via.b(), candidates, facility, issues);
                }
            }
        }
        return pairs;
    }

    private static MatchedPair firstMatch(MatchStrategy strategy, List<PatientRecord> groupA, List<PatientRecord> groupB) {
        for (PatientRecord a : groupA) {
            for (PatientRecord b : groupB) {
                if (strategy.matches(a, b)) {
                    return new MatchedPair(a, b, strategy.rule());
                }
            }
        }
        return null;
    }

    private static List<List<PatientRecord>> singletons(List<PatientRecord> records) {
        List<List<PatientRecord>> groups = new ArrayList<>(records.size());
        for (PatientRecord record : records) {
            groups.add(List.of(record));
        }
        return groups;
    }

    private void logPartialMatch(PatientRecord a, PatientRecord b, int candidates,
                                 FacilityKey facility, IssueLog issues) {
        log.info("Partial-name match - runId: {}, facility: {}, record: {} ({}), candidate: {} ({}), candidates: {}",
                issues.getRunId(), facility,
                PatientNameMasker.mask(a.getFirstName(), a.getLastName()), a.getRecordId(),
                PatientNameMasker.mask(b.getFirstName(), b.getLastName()), b.getRecordId(),
                candidates);
        if (candidates > 1) {
            issues.add(ReconciliationIssue.builder()
                    .type(IssueType.AMBIGUOUS_MATCH)
                    .facility(facility.value())
                    .extractType(a.getExtractType())
                    .batchId(a.getBatchId())
                    .recordId(a.getRecordId())
                    .detail(candidates + " partial-name candidates, took " + b.getRecordId())
                    .build());
        }
    }

    private List<PatientRecord> sameFacility(List<PatientRecord> records, FacilityKey facility, IssueLog issues) {
        List<PatientRecord> accepted = new ArrayList<>(records.size());
        for (PatientRecord record : records) {
            if (Objects.equals(record.getFacilityKey(), facility)) {
                accepted.add(record);
            } else {
                issues.add(ReconciliationIssue.builder()
                        .type(IssueType.CROSS_FACILITY_MATCH_ATTEMPT)
                        .facility(facility.value())
                        .extractType(record.getExtractType())
                        .batchId(record.getBatchId())
                        .recordId(record.getRecordId())
                        .detail("record belongs to facility '" + record.getFacilityKey() + "'")
                        .build());
            }
        }
        return accepted;
    }

    private static MatchedIdentity identity(FacilityKey facility, int ordinal,
                                            List<PatientRecord> records, Set<MatchRule> rules) {
        return MatchedIdentity.builder()
                .identityId(facility.value() + "#" + ordinal)
                .facilityKey(facility)
                .records(records)
                .rules(rules)
                .build();
    }

    /**
     * Two records joined by one rule.
     */
    public record MatchedPair(PatientRecord a, PatientRecord b, MatchRule rule) {
    }

    /**
     * Two groups joined by one rule, with the member records that matched.
     */
    public record GroupPair(int groupA, int groupB, MatchedPair via) {
    }

    /**
     * Outcome of one cascade: the records that passed the facility check and the pairs found among them.
     */
    public record Pairing(List<PatientRecord> acceptedA, List<PatientRecord> acceptedB, List<MatchedPair> pairs) {
    }
}
