package com.dataflywheel.evaluation;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record EvaluationResult(
        String modelIdentifier,
        String datasetSliceRef,
        List<RecordScore> perRecordScores,
        double aggregateScore,
        int toolCallingRecords,
        Instant computedAt) {

    public EvaluationResult {
        perRecordScores = List.copyOf(perRecordScores);
    }

    @JsonIgnore
    public long skippedCount() {
        return perRecordScores.stream().filter(RecordScore::isSkipped).count();
    }

    @JsonIgnore
    public long scoredCount() {
        return perRecordScores.size() - skippedCount();
    }
}
