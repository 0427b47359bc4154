package com.medReports.facilityRecon.extract.service;

import com.medReports.facilityRecon.extract.model.ExtractBatch;
import com.medReports.facilityRecon.reconcile.model.ReconciliationIssue;
import lombok.Value;

import java.util.List;

/**
 * A loaded batch with the row-level issues found while loading it.
 */
@Value
public class ExtractLoadResult {

    ExtractBatch batch;

    List<ReconciliationIssue> issues;
}
