package com.medReports.facilityRecon.reconcile.model;

import com.medReports.facilityRecon.extract.model.ExtractBatch;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Input of one reconciliation run: the loaded batches of one upload and the settings to apply.
 */
@Value
@Builder
public class ReconciliationRequest {

    String runId;

    List<ExtractBatch> batches;

    ReconciliationSettings settings;

    /**
     * Issues found while loading the batches, reported with the run's own.
     */
    @Builder.Default
    List<ReconciliationIssue> loadIssues = List.of();
}
