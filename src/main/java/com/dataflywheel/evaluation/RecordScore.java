package com.dataflywheel.evaluation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordScore(String recordId, Double score, ScoreStatus status, String detail) {

    public static RecordScore scored(String recordId, double score) {
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be in [0,1], was " + score);
        }
        return new RecordScore(recordId, score, ScoreStatus.SCORED, null);
    }

    public static RecordScore skipped(String recordId, String reason) {
        return new RecordScore(recordId, null, ScoreStatus.SKIPPED, reason);
    }

    @JsonIgnore
    public boolean isSkipped() {
        return status == ScoreStatus.SKIPPED;
    }
}
