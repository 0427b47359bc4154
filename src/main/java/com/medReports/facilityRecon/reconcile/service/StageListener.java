package com.medReports.facilityRecon.reconcile.service;

import com.medReports.facilityRecon.reconcile.model.RunStage;

/**
 * Receives one event per stage a run reaches.
 */
@FunctionalInterface
public interface StageListener {

    StageListener NONE = (runId, stage) -> { };

    void stageCompleted(String runId, RunStage stage);
}
