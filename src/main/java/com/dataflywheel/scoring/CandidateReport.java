package com.dataflywheel.scoring;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CandidateReport(
        String label,
        String modelName,
        int computeUnitCount,
        boolean customizationEnabled,
        CandidateOutcome outcome,
        Double preScore,
        Double postScore,
        Double deltaPre,
        Double deltaPost,
        Double bestScore,
        boolean promotable,
        String customizedModel,
        long skippedRecords,
        List<String> missingData,
        String failure) {

    public CandidateReport {
        missingData = missingData == null ? List.of() : List.copyOf(missingData);
    }
}
