package com.medReports.facilityRecon.job.model;

import com.medReports.facilityRecon.export.ExportedReport;
import com.medReports.facilityRecon.reconcile.model.ReconciliationIssue;
import com.medReports.facilityRecon.reconcile.model.RunStage;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of one reconciliation job.
 *
 * Snapshots are immutable; the registry replaces a job's snapshot on every update, so pollers
 * never see a half-written state.
 */
@Value
@Builder(toBuilder = true)
public class JobState {

    String jobId;

    JobStatus status;

    /**
     * 0 to 100, derived from the last stage reached.
     */
    int progress;

    /**
     * Last stage reached, null before the run starts.
     */
    RunStage stage;

    String message;

    @Builder.Default
    List<String> files = List.of();

    @Builder.Default
    List<ReconciliationIssue> issues = List.of();

    /**
     * Files that could not be read, and the reason a failed job stopped.
     */
    @Builder.Default
    List<String> errors = List.of();

    /**
     * Exported artifacts; set once the job completes.
     */
    ExportedReport report;

    Instant createdAt;

    Instant updatedAt;
}
