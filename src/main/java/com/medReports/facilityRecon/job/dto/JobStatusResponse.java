package com.medReports.facilityRecon.job.dto;

import com.medReports.facilityRecon.job.model.JobStatus;
import com.medReports.facilityRecon.reconcile.model.IssueType;
import com.medReports.facilityRecon.reconcile.model.RunStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for job status polling.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobStatusResponse {

    private String jobId;
    private JobStatus status;
    private int progress;
    private RunStage stage;
    private String message;
    private List<String> files;

    /**
     * Number of accumulated issues per type; the issues themselves are served separately.
     */
    private Map<IssueType, Long> issueCounts;

    private List<String> errors;
    private Instant createdAt;
    private Instant updatedAt;
}
