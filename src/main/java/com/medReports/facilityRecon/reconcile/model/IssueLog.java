package com.medReports.facilityRecon.reconcile.model;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Accumulates the issues of one facility or one run stage.
 *
 * Each worker owns its own log; logs are merged once the worker finishes.
 */
@Slf4j
public class IssueLog {

    private final String runId;
    private final List<ReconciliationIssue> issues = new ArrayList<>();

    public IssueLog(String runId) {
        this.runId = runId;
    }

    public void add(ReconciliationIssue issue) {
        if (issue.getType() == IssueType.CROSS_FACILITY_MATCH_ATTEMPT) {
            log.warn("{} - runId: {}, facility: {}, batch: {}, detail: {}",
                    issue.getType(), runId, issue.getFacility(), issue.getBatchId(), issue.getDetail());
        } else {
            log.debug("{} - runId: {}, facility: {}, batch: {}, detail: {}",
                    issue.getType(), runId, issue.getFacility(), issue.getBatchId(), issue.getDetail());
        }
        issues.add(issue);
    }

    public void addAll(Collection<ReconciliationIssue> more) {
        more.forEach(this::add);
    }

    public List<ReconciliationIssue> toList() {
        return List.copyOf(issues);
    }

    public String getRunId() {
        return runId;
    }
}
