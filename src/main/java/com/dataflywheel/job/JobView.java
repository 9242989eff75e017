package com.dataflywheel.job;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record JobView(
        String jobId,
        String workloadId,
        String clientId,
        JobState state,
        Map<String, String> candidateStages,
        String failureType,
        String failureMessage,
        String reportArtifactRef,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt) {

    static JobView of(FlywheelJobSnapshot snapshot) {
        Map<String, String> candidateStages = new LinkedHashMap<>();
        for (CandidateResult candidate : snapshot.candidates()) {
            candidateStages.put(candidate.config().label(), candidate.stage().name());
        }
        return new JobView(snapshot.jobId(), snapshot.workloadId(), snapshot.clientId(), snapshot.state(), candidateStages,
                snapshot.failureType(), snapshot.failureMessage(), snapshot.reportArtifactRef(),
                snapshot.createdAt(), snapshot.startedAt(), snapshot.finishedAt());
    }
}
