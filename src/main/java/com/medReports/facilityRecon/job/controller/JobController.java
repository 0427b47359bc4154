package com.medReports.facilityRecon.job.controller;

import com.medReports.facilityRecon.job.dto.JobStatusResponse;
import com.medReports.facilityRecon.job.service.JobService;
import com.medReports.facilityRecon.reconcile.model.ReconciliationIssue;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Job REST controller - status polling, issues and artifact downloads.
 */
@Validated
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
public class JobController {

    private static final String JOB_ID_PATTERN = "[A-Za-z0-9-]{1,64}";
    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final JobService jobService;

    @GetMapping("/{jobId}")
    public ResponseEntity<JobStatusResponse> status(@PathVariable @Pattern(regexp = JOB_ID_PATTERN) String jobId) {
        return ResponseEntity.ok(jobService.getStatus(jobId));
    }

    @GetMapping("/{jobId}/issues")
    public ResponseEntity<List<ReconciliationIssue>> issues(@PathVariable @Pattern(regexp = JOB_ID_PATTERN) String jobId) {
        return ResponseEntity.ok(jobService.getIssues(jobId));
    }

    /**
     * Facility summary; 409 until the job has completed.
     */
    @GetMapping("/{jobId}/summary.csv")
    public ResponseEntity<String> summary(@PathVariable @Pattern(regexp = JOB_ID_PATTERN) String jobId) {
        return csv("facility_summary.csv", jobService.getSummaryCsv(jobId));
    }

    /**
     * Listing of every matched patient; 409 until the job has completed.
     */
    @GetMapping("/{jobId}/all-patients.csv")
    public ResponseEntity<String> allPatients(@PathVariable @Pattern(regexp = JOB_ID_PATTERN) String jobId) {
        return csv("all_patients.csv", jobService.getAllPatientsCsv(jobId));
    }

    private static ResponseEntity<String> csv(String fileName, String body) {
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .body(body);
    }
}
