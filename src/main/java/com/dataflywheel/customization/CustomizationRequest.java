package com.dataflywheel.customization;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CustomizationRequest(
        @JsonProperty("base_model") String baseModelIdentifier,
        @JsonProperty("training_dataset") String trainingDatasetRef,
        TrainingHyperparameters hyperparameters) {
}
