package com.dataflywheel.job;

import com.dataflywheel.customization.CustomizationJobHandle;
import com.dataflywheel.evaluation.EvaluationResult;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CandidateResult(
        CandidateConfig config,
        CandidateStage stage,
        EvaluationResult pre,
        CustomizationJobHandle customization,
        EvaluationResult post,
        CandidateFailure failure) {
}
