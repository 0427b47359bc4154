package com.medReports.facilityRecon.extract.model;

/**
 * Functional-assessment scores of one assessment period. Either score may be missing.
 */
public record AssessmentScores(Double startScore, Double endScore) {

    public boolean isComplete() {
        return startScore != null && endScore != null;
    }

    public double gain() {
        if (!isComplete()) {
            throw new IllegalStateException("Gain requires both start and end score");
        }
        return endScore - startScore;
    }
}
