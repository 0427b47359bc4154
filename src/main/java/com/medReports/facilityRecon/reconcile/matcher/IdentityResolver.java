package com.medReports.facilityRecon.reconcile.matcher;

import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.facility.model.FacilityKey;
import com.medReports.facilityRecon.reconcile.model.IdentityResolution;
import com.medReports.facilityRecon.reconcile.model.IssueLog;
import com.medReports.facilityRecon.reconcile.model.MatchRule;
import com.medReports.facilityRecon.reconcile.model.MatchedIdentity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves patient identities across any number of batches of one facility.
 *
 * Rows of one batch that share a patient id or an exact name with any row of a group join
 * that group. Groups of every pair of batches are then matched with the full cascade, where
 * any member of one group may match any member of the other, and matches are merged
 * transitively: if A matches B and B matches C, A, B and C are one identity.
 */
@Slf4j
public class IdentityResolver {

    private final PatientIdentityMatcher matcher;
    private final List<MatchStrategy> exactStrategies;

    public IdentityResolver(PatientIdentityMatcher matcher) {
        this.matcher = matcher;
        this.exactStrategies = matcher.getStrategies().stream()
                .filter(s -> s.rule() != MatchRule.PARTIAL_NAME)
                .toList();
    }

    public IdentityResolution resolve(FacilityKey facility, List<List<PatientRecord>> batches, IssueLog issues) {
        requireUniqueRecordIds(batches);

        List<Group> groups = new ArrayList<>();
        List<List<Group>> groupsByBatch = new ArrayList<>();
        for (List<PatientRecord> batch : batches) {
            List<Group> batchGroups = collapse(batch, facility, groups.size(), issues);
            groups.addAll(batchGroups);
            groupsByBatch.add(batchGroups);
        }

        UnionFind unionFind = new UnionFind(groups.size());
        for (int i = 0; i < groupsByBatch.size(); i++) {
            for (int j = i + 1; j < groupsByBatch.size(); j++) {
                link(groupsByBatch.get(i), groupsByBatch.get(j), facility, issues, unionFind);
            }
        }

        Map<Integer, List<Group>> components = new LinkedHashMap<>();
        for (Group group : groups) {
            components.computeIfAbsent(unionFind.find(group.index), k -> new ArrayList<>()).add(group);
        }

        List<MatchedIdentity> identities = new ArrayList<>(components.size());
        for (List<Group> component : components.values()) {
            List<PatientRecord> records = new ArrayList<>();
            Set<MatchRule> rules = EnumSet.noneOf(MatchRule.class);
            for (Group group : component) {
                records.addAll(group.records);
                rules.addAll(group.rules);
            }
            identities.add(MatchedIdentity.builder()
                    .identityId(facility.value() + "#" + (identities.size() + 1))
                    .facilityKey(facility)
                    .records(List.copyOf(records))
                    .rules(Set.copyOf(rules))
                    .build());
        }

        log.debug("Identities resolved - runId: {}, facility: {}, batches: {}, records: {}, identities: {}",
                issues.getRunId(), facility, batches.size(),
                identities.stream().mapToInt(id -> id.getRecords().size()).sum(), identities.size());
        return new IdentityResolution(facility, identities);
    }

    private List<Group> collapse(List<PatientRecord> batch, FacilityKey facility, int firstIndex, IssueLog issues) {
        // the matcher's facility check, applied once per batch
        List<PatientRecord> accepted = matcher.pair(batch, List.of(), facility, issues).acceptedA();

        List<Group> batchGroups = new ArrayList<>();
        for (PatientRecord record : accepted) {
            Group target = null;
            MatchRule joinedBy = null;
            for (Group group : batchGroups) {
                joinedBy = group.exactRule(record, exactStrategies);
                if (joinedBy != null) {
                    target = group;
                    break;
                }
            }
            if (target == null) {
                batchGroups.add(new Group(firstIndex + batchGroups.size(), record));
            } else {
                target.add(record, joinedBy);
            }
        }
        return batchGroups;
    }

    private void link(List<Group> left, List<Group> right, FacilityKey facility, IssueLog issues, UnionFind unionFind) {
        List<List<PatientRecord>> leftRecords = left.stream().map(group -> group.records).toList();
        List<List<PatientRecord>> rightRecords = right.stream().map(group -> group.records).toList();

        for (PatientIdentityMatcher.GroupPair matched : matcher.pairGroups(leftRecords, rightRecords, facility, issues)) {
            Group a = left.get(matched.groupA());
            Group b = right.get(matched.groupB());
            unionFind.union(a.index, b.index);
            a.rules.add(matched.via().rule());
            b.rules.add(matched.via().rule());
        }
    }

    private static void requireUniqueRecordIds(List<List<PatientRecord>> batches) {
        Set<String> seen = new HashSet<>();
        for (List<PatientRecord> batch : batches) {
            for (PatientRecord record : batch) {
                if (record.getRecordId() == null || !seen.add(record.getRecordId())) {
                    throw new IllegalArgumentException("Record ids must be present and unique: " + record.getRecordId());
                }
            }
        }
    }

    /**
     * Records of one batch taken to be the same patient.
     */
    private static final class Group {
        private final int index;
        private final List<PatientRecord> records = new ArrayList<>();
        private final Set<MatchRule> rules = EnumSet.noneOf(MatchRule.class);

        private Group(int index, PatientRecord first) {
            this.index = index;
            this.records.add(first);
        }

        private void add(PatientRecord record, MatchRule rule) {
            records.add(record);
            rules.add(rule);
        }

        /**
         * First exact rule joining the record to any member, or null.
         */
        private MatchRule exactRule(PatientRecord record, List<MatchStrategy> strategies) {
            for (MatchStrategy strategy : strategies) {
                for (PatientRecord member : records) {
                    if (strategy.matches(member, record)) {
                        return strategy.rule();
                    }
                }
            }
            return null;
        }
    }

    private static final class UnionFind {
        private final int[] parent;

        private UnionFind(int size) {
            parent = new int[size];
            for (int i = 0; i < size; i++) {
                parent[i] = i;
            }
        }

        private int find(int node) {
            while (parent[node] != node) {
                parent[node] = parent[parent[node]];
                node = parent[node];
            }
            return node;
        }

        private void union(int a, int b) {
            int rootA = find(a);
            int rootB = find(b);
            if (rootA == rootB) {
                return;
            }
            // lower root wins so component order follows first appearance
            if (rootA < rootB) {
                parent[rootB] = rootA;
            } else {
                parent[rootA] = rootB;
            }
        }
    }
}
