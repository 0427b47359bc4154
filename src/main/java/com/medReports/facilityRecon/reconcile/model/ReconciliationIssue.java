package com.medReports.facilityRecon.reconcile.model;

import com.medReports.facilityRecon.extract.model.ExtractType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReconciliationIssue {

    IssueType type;

    /**
     * Facility key value, or null when the issue precedes normalization.
     */
    String facility;

    ExtractType extractType;

    String batchId;

    String recordId;

    String detail;
}
