package com.medReports.facilityRecon.reconcile.service;

import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.facility.model.FacilityKey;
import com.medReports.facilityRecon.reconcile.matcher.IdentityResolver;
import com.medReports.facilityRecon.reconcile.model.DeduplicatedEncounter;
import com.medReports.facilityRecon.reconcile.model.DeduplicatedEncounterSet;
import com.medReports.facilityRecon.reconcile.model.IdentityResolution;
import com.medReports.facilityRecon.reconcile.model.IssueLog;
import com.medReports.facilityRecon.reconcile.model.MatchedIdentity;
import com.medReports.facilityRecon.reconcile.model.ReportingPeriod;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Counts qualifying encounters of one facility across overlapping batches.
 *
 * The gross count is the plain number of qualifying rows. The unique-patient count is the number
 * of distinct matched identities among them. Encounters are keyed by identity and reporting period,
 * so a patient listed in two overlapping monthly extracts becomes one encounter per period.
 */
@Slf4j
public class EncounterDeduplicator {

    private final IdentityResolver identityResolver;
    private final ReportingPeriod reportingPeriod;

    public EncounterDeduplicator(IdentityResolver identityResolver, ReportingPeriod reportingPeriod) {
        this.identityResolver = identityResolver;
        this.reportingPeriod = reportingPeriod;
    }

    /**
     * Resolves identities across the batches, then deduplicates the rows the filter accepts.
     *
     * @param facility Facility the batches belong to
     * @param batches Record batches in upload order
     * @param filter Qualifying-row predicate, e.g. place of service 32
     * @param issues Issue log of the current run
     * @return Encounter set; both counts are zero when no row qualifies
     */
    public DeduplicatedEncounterSet deduplicate(FacilityKey facility, List<List<PatientRecord>> batches,
                                                Predicate<PatientRecord> filter, IssueLog issues) {
        IdentityResolution resolution = identityResolver.resolve(facility, batches, issues);
        return deduplicate(resolution, batches, filter);
    }

    /**
     * Deduplicates the rows the filter accepts against identities resolved beforehand.
     * Rows the resolution does not hold (other facilities) are not counted at all.
     */
    public DeduplicatedEncounterSet deduplicate(IdentityResolution resolution, List<List<PatientRecord>> batches,
                                                Predicate<PatientRecord> filter) {
        int gross = 0;
        Map<EncounterKey, List<PatientRecord>> byKey = new LinkedHashMap<>();
        for (List<PatientRecord> batch : batches) {
            for (PatientRecord record : batch) {
                MatchedIdentity identity = resolution.identityOf(record);
                if (identity == null || !filter.test(record)) {
                    continue;
                }
                gross++;
                EncounterKey key = new EncounterKey(identity.getIdentityId(), reportingPeriod.bucket(record.getEncounterDate()));
                byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
            }
        }

        if (gross == 0) {
            return DeduplicatedEncounterSet.empty();
        }

        List<DeduplicatedEncounter> encounters = new ArrayList<>(byKey.size());
        Set<String> patients = new HashSet<>();
        for (Map.Entry<EncounterKey, List<PatientRecord>> entry : byKey.entrySet()) {
            patients.add(entry.getKey().identityId());
            encounters.add(DeduplicatedEncounter.builder()
                    .facilityKey(resolution.getFacilityKey())
                    .identityId(entry.getKey().identityId())
                    .period(entry.getKey().period())
                    .sourceRecords(List.copyOf(entry.getValue()))
                    .build());
        }

        log.debug("Encounters deduplicated - facility: {}, gross: {}, encounters: {}, patients: {}",
                resolution.getFacilityKey(), gross, encounters.size(), patients.size());
        return new DeduplicatedEncounterSet(gross, patients.size(), List.copyOf(encounters));
    }

    private record EncounterKey(String identityId, String period) {
    }
}
