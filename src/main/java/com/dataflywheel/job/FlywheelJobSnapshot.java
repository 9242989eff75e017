package com.dataflywheel.job;

import java.time.Instant;
import java.util.List;

import com.dataflywheel.evaluation.EvaluationResult;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlywheelJobSnapshot(
        String jobId,
        String workloadId,
        String clientId,
        JobState state,
        EvaluationResult baseline,
        List<CandidateResult> candidates,
        String failureType,
        String failureMessage,
        String reportArtifactRef,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt) {
}
