package com.dataflywheel.scoring;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportArtifact(
        BaselineSummary baseline,
        double tolerance,
        List<CandidateReport> candidates,
        String recommendedCandidate,
        int toolCallingRecords,
        int freeTextRecords,
        String comparisonPlot,
        Instant generatedAt) {

    public static final String COMPARISON_PLOT_FILE = "comparison.svg";

    public ReportArtifact {
        candidates = List.copyOf(candidates);
    }
}
