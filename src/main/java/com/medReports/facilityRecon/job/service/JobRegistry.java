package com.medReports.facilityRecon.job.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.medReports.facilityRecon.job.exception.JobNotFoundException;
import com.medReports.facilityRecon.job.model.JobState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.function.UnaryOperator;

/**
 * Job registry - keeps job snapshots in a Caffeine cache.
 *
 * Responsibilities:
 * - Register new jobs
 * - Replace a job's snapshot atomically on every update
 * - Expire jobs once the retention period has passed since their last update
 */
@Slf4j
@Service
public class JobRegistry {

    private static final int MAX_JOBS = 1_000;

    private final Cache<String, JobState> jobs;

    public JobRegistry(@Value("${recon.jobs.retention:PT24H}") String retention) {
        Duration ttl = Duration.parse(retention);
        this.jobs = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(MAX_JOBS)
                .removalListener((String jobId, JobState state, RemovalCause cause) -> {
                    if (state != null) {
                        log.debug("Job evicted - runId: {}, status: {}, cause: {}", jobId, state.getStatus(), cause);
                    }
                })
                .build();
    }

    public void register(JobState state) {
        jobs.put(state.getJobId(), state);
        log.info("Job registered - runId: {}, files: {}", state.getJobId(), state.getFiles().size());
    }

    /**
     * @throws JobNotFoundException if the job is unknown or has expired
     */
    public JobState get(String jobId) {
        JobState state = jobs.getIfPresent(jobId);
        if (state == null) {
            throw new JobNotFoundException("No job found with id " + jobId);
        }
        return state;
    }

    /**
     * Replaces the job's snapshot with the result of the update. Updates of an expired job are dropped.
     */
    public void update(String jobId, UnaryOperator<JobState> update) {
        JobState updated = jobs.asMap().computeIfPresent(jobId,
                (id, current) -> update.apply(current).toBuilder().updatedAt(Instant.now()).build());
        if (updated == null) {
            log.warn("Update of unknown job dropped - runId: {}", jobId);
        }
    }
}
