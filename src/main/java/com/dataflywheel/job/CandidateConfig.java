package com.dataflywheel.job;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record CandidateConfig(
        @JsonProperty("model_name") @JsonAlias("modelName") String modelName,
        @JsonProperty("context_length") @JsonAlias("contextLength") int contextLength,
        @JsonProperty("gpus") @JsonAlias({ "compute_unit_count", "computeUnitCount" }) int computeUnitCount,
        @JsonProperty("pvc_size") @JsonAlias({ "storage_size", "storageSize" }) String storageSize,
        @JsonProperty("tag") @JsonAlias({ "runtime_tag", "runtimeTag" }) String runtimeTag,
        @JsonProperty("customization_enabled") @JsonAlias("customizationEnabled") boolean customizationEnabled) {

    public void validate() {
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("candidate model_name is required");
        }
        if (contextLength < 0) {
            throw new IllegalArgumentException("candidate context_length must be >= 0 for " + modelName);
        }
        if (computeUnitCount < 0) {
            throw new IllegalArgumentException("candidate gpus must be >= 0 for " + modelName);
        }
    }

    @JsonIgnore
    public String label() {
        return runtimeTag == null || runtimeTag.isBlank() ? modelName : modelName + ":" + runtimeTag;
    }
}
