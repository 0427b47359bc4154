package com.medReports.facilityRecon.job.service;

import com.medReports.facilityRecon.config.ReconciliationConfig;
import com.medReports.facilityRecon.export.ExportedReport;
import com.medReports.facilityRecon.extract.exception.ExtractParseException;
import com.medReports.facilityRecon.extract.model.ExtractBatch;
import com.medReports.facilityRecon.extract.service.CsvExtractLoader;
import com.medReports.facilityRecon.extract.service.ExtractLoadResult;
import com.medReports.facilityRecon.job.dto.JobStatusResponse;
import com.medReports.facilityRecon.job.exception.ArtifactNotReadyException;
import com.medReports.facilityRecon.job.exception.NoFilesUploadedException;
import com.medReports.facilityRecon.job.model.JobState;
import com.medReports.facilityRecon.job.model.JobStatus;
import com.medReports.facilityRecon.job.model.UploadedExtract;
import com.medReports.facilityRecon.reconcile.exception.NoUsableExtractException;
import com.medReports.facilityRecon.reconcile.exception.ReconciliationStageException;
import com.medReports.facilityRecon.reconcile.model.IssueType;
import com.medReports.facilityRecon.reconcile.model.ReconciliationIssue;
import com.medReports.facilityRecon.reconcile.model.ReconciliationRequest;
import com.medReports.facilityRecon.reconcile.model.ReconciliationResult;
import com.medReports.facilityRecon.reconcile.model.RunStage;
import com.medReports.facilityRecon.reconcile.service.ReconciliationPipeline;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Job service - runs uploads through the reconciliation pipeline in the background.
 *
 * Responsibilities:
 * - Register a job per upload and queue it on a bounded pool
 * - Load the uploaded extracts, then run the pipeline with fresh settings
 * - Map stage events to a progress percentage
 * - Serve status, issues and exported artifacts of finished jobs
 */
@Slf4j
@Service
public class JobService {

    private final JobRegistry jobRegistry;
    private final JobIdService jobIdService;
    private final CsvExtractLoader extractLoader;
    private final ReconciliationPipeline pipeline;
    private final ReconciliationConfig reconciliationConfig;
    private final Executor executor;

    @Autowired
    public JobService(JobRegistry jobRegistry,
                      JobIdService jobIdService,
                      CsvExtractLoader extractLoader,
                      ReconciliationPipeline pipeline,
                      ReconciliationConfig reconciliationConfig,
                      @Value("${recon.jobs.max-concurrent:2}") int maxConcurrentJobs) {
        this(jobRegistry, jobIdService, extractLoader, pipeline, reconciliationConfig,
                Executors.newFixedThreadPool(Math.max(1, maxConcurrentJobs)));
    }

    JobService(JobRegistry jobRegistry,
               JobIdService jobIdService,
               CsvExtractLoader extractLoader,
               ReconciliationPipeline pipeline,
               ReconciliationConfig reconciliationConfig,
               Executor executor) {
        this.jobRegistry = jobRegistry;
        this.jobIdService = jobIdService;
        this.extractLoader = extractLoader;
        this.pipeline = pipeline;
        this.reconciliationConfig = reconciliationConfig;
        this.executor = executor;
    }

    /**
     * Registers a job for the uploaded files and queues it.
     *
     * @param uploads Uploaded files with their extract types
     * @return Initial job snapshot
     * @throws NoFilesUploadedException if no file was uploaded
     */
    public JobState submit(List<UploadedExtract> uploads) {
        if (uploads == null || uploads.isEmpty()) {
            throw new NoFilesUploadedException("At least one extract file is required");
        }

        Instant now = Instant.now();
        JobState state = JobState.builder()
                .jobId(jobIdService.generateJobId())
                .status(JobStatus.UPLOADED)
                .progress(0)
                .message("Files uploaded, waiting to be processed")
                .files(uploads.stream().map(UploadedExtract::fileName).toList())
                .createdAt(now)
                .updatedAt(now)
                .build();
        jobRegistry.register(state);

        List<UploadedExtract> queued = List.copyOf(uploads);
        executor.execute(() -> process(state.getJobId(), queued));
        return state;
    }

    public JobStatusResponse getStatus(String jobId) {
        JobState state = jobRegistry.get(jobId);
        Map<IssueType, Long> issueCounts = new EnumMap<>(IssueType.class);
        for (ReconciliationIssue issue : state.getIssues()) {
            issueCounts.merge(issue.getType(), 1L, Long::sum);
        }
        return JobStatusResponse.builder()
                .jobId(state.getJobId())
                .status(state.getStatus())
                .progress(state.getProgress())
                .stage(state.getStage())
                .message(state.getMessage())
                .files(state.getFiles())
                .issueCounts(issueCounts)
                .errors(state.getErrors())
                .createdAt(state.getCreatedAt())
                .updatedAt(state.getUpdatedAt())
                .build();
    }

    public List<ReconciliationIssue> getIssues(String jobId) {
        return jobRegistry.get(jobId).getIssues();
    }

    /**
     * @throws ArtifactNotReadyException until the job has completed
     */
    public String getSummaryCsv(String jobId) {
        return artifact(jobId, ExportedReport::summaryCsv);
    }

    /**
     * @throws ArtifactNotReadyException until the job has completed
     */
    public String getAllPatientsCsv(String jobId) {
        return artifact(jobId, ExportedReport::allPatientsCsv);
    }

    static int progressOf(RunStage stage) {
        return switch (stage) {
            case LOADED -> 10;
            case NORMALIZED -> 25;
            case MATCHED -> 45;
            case DEDUPLICATED -> 60;
            case AGGREGATED -> 80;
            case EXPORTED -> 100;
        };
    }

    void process(String jobId, List<UploadedExtract> uploads) {
        log.info("Processing job - runId: {}, files: {}", jobId, uploads.size());
        jobRegistry.update(jobId, s -> s.toBuilder()
                .status(JobStatus.PROCESSING)
                .message("Loading extracts")
                .build());

        try {
            List<ExtractBatch> batches = new ArrayList<>();
            List<ReconciliationIssue> loadIssues = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            for (int i = 0; i < uploads.size(); i++) {
                UploadedExtract upload = uploads.get(i);
                String batchId = upload.type().getCode() + "-" + (i + 1);
                try {
                    ExtractLoadResult loaded = extractLoader.load(upload.type(), batchId, upload.fileName(), upload.content());
                    batches.add(loaded.getBatch());
                    loadIssues.addAll(loaded.getIssues());
                } catch (ExtractParseException e) {
                    log.warn("Extract not readable - runId: {}, file: {}, reason: {}", jobId, upload.fileName(), e.getMessage());
                    errors.add(upload.fileName() + ": " + e.getMessage());
                }
            }
            List<String> loadErrors = List.copyOf(errors);
            jobRegistry.update(jobId, s -> s.toBuilder().errors(loadErrors).build());

            ReconciliationRequest request = ReconciliationRequest.builder()
                    .runId(jobId)
                    .batches(batches)
                    .settings(reconciliationConfig.newSettings())
                    .loadIssues(loadIssues)
                    .build();
            ReconciliationResult result = pipeline.run(request, (runId, stage) -> jobRegistry.update(runId, s -> s.toBuilder()
                    .stage(stage)
                    .progress(progressOf(stage))
                    .message("Reached " + stage)
                    .build()));

            jobRegistry.update(jobId, s -> s.toBuilder()
                    .status(JobStatus.COMPLETED)
                    .progress(100)
                    .message("Processed " + result.getRows().size() + " facilities")
                    .issues(result.getIssues())
                    .report(result.getReport())
                    .build());
            log.info("Job completed - runId: {}, facilities: {}, issues: {}",
                    jobId, result.getRows().size(), result.getIssues().size());
        } catch (NoUsableExtractException | ReconciliationStageException e) {
            log.error("Job failed - runId: {}, reason: {}", jobId, e.getMessage());
            fail(jobId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error in job - runId: {}", jobId, e);
            fail(jobId, "An unexpected error occurred");
        }
    }

    @PreDestroy
    void shutdown() {
        if (executor instanceof ExecutorService) {
            ((ExecutorService) executor).shutdownNow();
        }
    }

    private void fail(String jobId, String reason) {
        jobRegistry.update(jobId, s -> {
            List<String> errors = new ArrayList<>(s.getErrors());
            errors.add(reason);
            return s.toBuilder()
                    .status(JobStatus.ERROR)
                    .message(reason)
                    .errors(List.copyOf(errors))
                    .build();
        });
    }

    private String artifact(String jobId, Function<ExportedReport, String> part) {
        JobState state = jobRegistry.get(jobId);
        if (state.getStatus() != JobStatus.COMPLETED || state.getReport() == null) {
            throw new ArtifactNotReadyException("Job " + jobId + " is " + state.getStatus() + "; artifacts are not ready");
        }
        return part.apply(state.getReport());
    }
}
