package com.dataflywheel.customization;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CustomizationJobHandle(
        String candidateModelIdentifier,
        String trainingDatasetRef,
        String externalJobId,
        CustomizationState state,
        String resultModelIdentifier,
        String failureReason,
        Instant submittedAt,
        Instant updatedAt) {

    public CustomizationJobHandle {
        if (state == CustomizationState.SUCCEEDED && (resultModelIdentifier == null || resultModelIdentifier.isBlank())) {
            throw new IllegalArgumentException("a succeeded customization must name its result model");
        }
        if (state != CustomizationState.SUCCEEDED && resultModelIdentifier != null) {
            throw new IllegalArgumentException("result model is only set on SUCCEEDED");
        }
    }

    public static CustomizationJobHandle submitted(String candidateModel, String datasetRef, String externalJobId, Instant at) {
        return new CustomizationJobHandle(candidateModel, datasetRef, externalJobId, CustomizationState.SUBMITTED, null, null, at, at);
    }

    public CustomizationJobHandle advance(CustomizationStatus status, Instant at) {
        if (isTerminal()) {
            return this;
        }
        String result = status.state() == CustomizationState.SUCCEEDED ? status.resultModelIdentifier() : null;
        String reason = status.state() == CustomizationState.FAILED ? status.message() : null;
        return new CustomizationJobHandle(candidateModelIdentifier, trainingDatasetRef, externalJobId,
                status.state(), result, reason, submittedAt, at);
    }

    public CustomizationJobHandle fail(String reason, Instant at) {
        if (isTerminal()) {
            return this;
        }
        return new CustomizationJobHandle(candidateModelIdentifier, trainingDatasetRef, externalJobId,
                CustomizationState.FAILED, null, reason, submittedAt, at);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }
}
