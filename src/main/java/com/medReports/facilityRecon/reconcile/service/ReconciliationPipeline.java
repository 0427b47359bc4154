package com.medReports.facilityRecon.reconcile.service;

import com.medReports.facilityRecon.export.ExportedReport;
import com.medReports.facilityRecon.export.MetricColumnSchema;
import com.medReports.facilityRecon.export.MetricsExporter;
import com.medReports.facilityRecon.extract.model.ExtractBatch;
import com.medReports.facilityRecon.extract.model.ExtractType;
import com.medReports.facilityRecon.extract.model.PatientRecord;
import com.medReports.facilityRecon.facility.model.FacilityKey;
import com.medReports.facilityRecon.facility.service.FacilityDirectory;
import com.medReports.facilityRecon.facility.service.FacilityNormalizer;
import com.medReports.facilityRecon.reconcile.exception.NoUsableExtractException;
import com.medReports.facilityRecon.reconcile.exception.ReconciliationStageException;
import com.medReports.facilityRecon.reconcile.matcher.IdentityResolver;
import com.medReports.facilityRecon.reconcile.matcher.PatientIdentityMatcher;
import com.medReports.facilityRecon.reconcile.model.DeduplicatedEncounterSet;
import com.medReports.facilityRecon.reconcile.model.FacilityMetricsRow;
import com.medReports.facilityRecon.reconcile.model.IdentityResolution;
import com.medReports.facilityRecon.reconcile.model.IssueLog;
import com.medReports.facilityRecon.reconcile.model.IssueType;
import com.medReports.facilityRecon.reconcile.model.PatientSummaryRow;
import com.medReports.facilityRecon.reconcile.model.ReconciledRecordSet;
import com.medReports.facilityRecon.reconcile.model.ReconciliationIssue;
import com.medReports.facilityRecon.reconcile.model.ReconciliationRequest;
import com.medReports.facilityRecon.reconcile.model.ReconciliationResult;
import com.medReports.facilityRecon.reconcile.model.ReconciliationSettings;
import com.medReports.facilityRecon.reconcile.model.ReportingCategory;
import com.medReports.facilityRecon.reconcile.model.RunStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Reconciliation pipeline - runs one upload through every stage.
 *
 * Workflow:
 * LOADED -> NORMALIZED -> MATCHED -> DEDUPLICATED -> AGGREGATED -> EXPORTED
 *
 * Loading and normalization run on the calling thread. Matching, deduplication and aggregation
 * run per facility on a pool owned by the run; a stage completes when every facility has passed
 * it. Each run builds its own facility directory, matcher and issue logs, so concurrent runs
 * share nothing. Any failure aborts the run before export.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationPipeline {

    private final FacilityNormalizer facilityNormalizer;
    private final MetricsExporter metricsExporter;

    /**
     * Runs the pipeline without stage events.
     */
    public ReconciliationResult run(ReconciliationRequest request) {
        return run(request, StageListener.NONE);
    }

    /**
     * Runs the pipeline.
     *
     * @param request Batches and settings of the run
     * @param listener Notified once per stage reached
     * @return Rows, patients, accumulated issues and the exported report
     * @throws NoUsableExtractException when no batch holds a record
     * @throws ReconciliationStageException when a stage fails for a facility or extract
     */
    public ReconciliationResult run(ReconciliationRequest request, StageListener listener) {
        String runId = request.getRunId();
        ReconciliationSettings settings = request.getSettings();
        IssueLog runIssues = new IssueLog(runId);
        runIssues.addAll(request.getLoadIssues());
        log.info("Starting reconciliation - runId: {}, batches: {}", runId, request.getBatches().size());

        // Step 1: LOADED
        List<ExtractBatch> usable = load(request.getBatches(), runIssues);
        listener.stageCompleted(runId, RunStage.LOADED);

        // Step 2: NORMALIZED
        Map<FacilityKey, FacilityInput> facilities = normalize(usable, settings, runIssues);
        listener.stageCompleted(runId, RunStage.NORMALIZED);
        log.info("Facilities normalized - runId: {}, facilities: {}", runId, facilities.size());

        IdentityResolver identityResolver = new IdentityResolver(
                PatientIdentityMatcher.standard(settings.getLastNamePrefixLength()));
        EncounterDeduplicator deduplicator = new EncounterDeduplicator(identityResolver, settings.getReportingPeriod());
        MetricsAggregator aggregator = new MetricsAggregator(settings);

        Map<FacilityKey, IssueLog> facilityIssues = new LinkedHashMap<>();
        facilities.keySet().forEach(key -> facilityIssues.put(key, new IssueLog(runId)));

        int threads = Math.max(1, Math.min(settings.getParallelism(), facilities.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        Map<FacilityKey, FacilityOutcome> outcomes;
        try {
            // Step 3: MATCHED
            Map<FacilityKey, IdentityResolution> resolutions = runStage(RunStage.MATCHED, facilities, facilities, executor,
                    (key, input) -> identityResolver.resolve(key, input.batches(), facilityIssues.get(key)));
            listener.stageCompleted(runId, RunStage.MATCHED);

            // Step 4: DEDUPLICATED
            Map<FacilityKey, ReconciledRecordSet> reconciled = runStage(RunStage.DEDUPLICATED, resolutions, facilities, executor,
                    (key, resolution) -> deduplicate(facilities.get(key), resolution, settings, deduplicator));
            listener.stageCompleted(runId, RunStage.DEDUPLICATED);

            // Step 5: AGGREGATED
            outcomes = runStage(RunStage.AGGREGATED, reconciled, facilities, executor,
                    (key, records) -> new FacilityOutcome(aggregator.aggregate(key, records), aggregator.listPatients(records)));
            listener.stageCompleted(runId, RunStage.AGGREGATED);
        } finally {
            executor.shutdownNow();
        }

        List<FacilityMetricsRow> rows = new ArrayList<>(outcomes.size());
        List<PatientSummaryRow> patients = new ArrayList<>();
        outcomes.values().forEach(outcome -> {
            rows.add(outcome.row());
            patients.addAll(outcome.patients());
        });
        facilityIssues.values().forEach(issues -> runIssues.addAll(issues.toList()));

        // Step 6: EXPORTED
        ExportedReport report;
        try {
            report = metricsExporter.export(MetricColumnSchema.forSettings(settings), rows, patients);
        } catch (RuntimeException e) {
            throw new ReconciliationStageException(RunStage.EXPORTED, "all", "all", e);
        }
        listener.stageCompleted(runId, RunStage.EXPORTED);

        List<ReconciliationIssue> issues = runIssues.toList();
        log.info("Reconciliation completed - runId: {}, facilities: {}, patients: {}, issues: {}",
                runId, rows.size(), patients.size(), issues.size());
        return ReconciliationResult.builder()
                .runId(runId)
                .rows(List.copyOf(rows))
                .patients(List.copyOf(patients))
                .issues(issues)
                .report(report)
                .build();
    }

    private List<ExtractBatch> load(List<ExtractBatch> batches, IssueLog issues) {
        List<ExtractBatch> usable = new ArrayList<>();
        Set<ExtractType> missing = EnumSet.allOf(ExtractType.class);
        for (ExtractBatch batch : batches) {
            if (batch.isEmpty()) {
                issues.add(ReconciliationIssue.builder()
                        .type(IssueType.EMPTY_EXTRACT)
                        .extractType(batch.getExtractType())
                        .batchId(batch.getBatchId())
                        .detail("'" + batch.getFileName() + "' holds no records")
                        .build());
                continue;
            }
            usable.add(batch);
            missing.remove(batch.getExtractType());
        }

        if (usable.isEmpty()) {
            throw new NoUsableExtractException("No usable extract in run " + issues.getRunId()
                    + ": " + batches.size() + " batch(es) uploaded, none holds a record");
        }

        for (ExtractType type : missing) {
            issues.add(ReconciliationIssue.builder()
                    .type(IssueType.EMPTY_EXTRACT)
                    .extractType(type)
                    .detail("no " + type.getCode() + " records uploaded; metrics from this extract report zero")
                    .build());
        }
        return usable;
    }

    private Map<FacilityKey, FacilityInput> normalize(List<ExtractBatch> batches, ReconciliationSettings settings,
                                                      IssueLog issues) {
        FacilityDirectory directory = facilityNormalizer.newDirectory(settings.getKnownFacilities());
        Map<FacilityKey, List<List<PatientRecord>>> batchesByFacility = new TreeMap<>();
        Map<FacilityKey, Set<String>> filesByFacility = new TreeMap<>();
        Set<FacilityKey> reported = new LinkedHashSet<>();

        for (ExtractBatch batch : batches) {
            Map<FacilityKey, List<PatientRecord>> split = new LinkedHashMap<>();
            try {
                for (PatientRecord record : batch.getRecords()) {
                    FacilityKey key = directory.resolve(record.getFacilityLabel());
                    split.computeIfAbsent(key, k -> new ArrayList<>()).add(record.toBuilder().facilityKey(key).build());
                    if (!directory.isExpected(key) && reported.add(key)) {
                        issues.add(ReconciliationIssue.builder()
                                .type(IssueType.UNRESOLVED_FACILITY)
                                .facility(key.value())
                                .extractType(batch.getExtractType())
                                .batchId(batch.getBatchId())
                                .recordId(record.getRecordId())
                                .detail("label '" + record.getFacilityLabel() + "' is not a known facility")
                                .build());
                    }
                }
            } catch (RuntimeException e) {
                throw new ReconciliationStageException(RunStage.NORMALIZED, "unknown", batch.getFileName(), e);
            }
            split.forEach((key, records) -> {
                batchesByFacility.computeIfAbsent(key, k -> new ArrayList<>()).add(List.copyOf(records));
                filesByFacility.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(batch.getFileName());
            });
        }

        // known facilities without records still get a row of zeros
        for (String label : settings.getKnownFacilities()) {
            FacilityKey key = directory.resolve(label);
            batchesByFacility.computeIfAbsent(key, k -> new ArrayList<>());
            filesByFacility.computeIfAbsent(key, k -> new LinkedHashSet<>());
        }

        Map<FacilityKey, FacilityInput> facilities = new LinkedHashMap<>();
        batchesByFacility.forEach((key, facilityBatches) -> facilities.put(key, new FacilityInput(
                directory.displayName(key),
                Collections.unmodifiableList(facilityBatches),
                String.join(", ", filesByFacility.get(key)))));
        return facilities;
    }

    private static ReconciledRecordSet deduplicate(FacilityInput input, IdentityResolution resolution,
                                                   ReconciliationSettings settings, EncounterDeduplicator deduplicator) {
        Map<String, DeduplicatedEncounterSet> encounters = new LinkedHashMap<>();
        for (ReportingCategory category : settings.categories()) {
            encounters.put(category.name(), deduplicator.deduplicate(resolution, input.batches(), category.filter()));
        }
        return ReconciledRecordSet.builder()
                .facilityKey(resolution.getFacilityKey())
                .facilityName(input.displayName())
                .batches(input.batches())
                .identities(resolution)
                .categoryEncounters(Collections.unmodifiableMap(encounters))
                .build();
    }

    /**
     * Applies one step to every facility on the run's pool and waits for all of them.
     * Results keep facility order.
     */
    private static <I, O> Map<FacilityKey, O> runStage(RunStage stage, Map<FacilityKey, I> inputs,
                                                       Map<FacilityKey, FacilityInput> facilities,
                                                       ExecutorService executor, FacilityStep<I, O> step) {
        Map<FacilityKey, Future<O>> futures = new LinkedHashMap<>();
        inputs.forEach((key, input) -> futures.put(key, executor.submit(() -> step.apply(key, input))));

        Map<FacilityKey, O> results = new LinkedHashMap<>();
        for (Map.Entry<FacilityKey, Future<O>> entry : futures.entrySet()) {
            FacilityKey key = entry.getKey();
            try {
                results.put(key, entry.getValue().get());
            } catch (ExecutionException e) {
                futures.values().forEach(future -> future.cancel(true));
                throw new ReconciliationStageException(stage, key.value(), facilities.get(key).files(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(future -> future.cancel(true));
                throw new ReconciliationStageException(stage, key.value(), facilities.get(key).files(), e);
            }
        }
        return results;
    }

    @FunctionalInterface
    private interface FacilityStep<I, O> {
        O apply(FacilityKey facility, I input);
    }

    private record FacilityInput(String displayName, List<List<PatientRecord>> batches, String files) {
    }

    private record FacilityOutcome(FacilityMetricsRow row, List<PatientSummaryRow> patients) {
    }
}
