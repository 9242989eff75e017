package com.dataflywheel.customization;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

public record TrainingHyperparameters(
        int epochs,
        @JsonProperty("learning_rate") @JsonAlias("learningRate") double learningRate,
        @JsonProperty("batch_size") @JsonAlias("batchSize") int batchSize,
        @JsonProperty("adapter_dim") @JsonAlias("adapterDim") int adapterDim) {

    public static TrainingHyperparameters defaults() {
        return new TrainingHyperparameters(2, 0.0001, 16, 32);
    }
}
