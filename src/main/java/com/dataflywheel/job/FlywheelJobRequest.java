package com.dataflywheel.job;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FlywheelJobRequest(
        @JsonProperty("workload_id") @JsonAlias("workloadId") String workloadId,
        @JsonProperty("client_id") @JsonAlias("clientId") String clientId,
        List<CandidateConfig> configs) {

    public FlywheelJobRequest {
        configs = configs == null ? List.of() : List.copyOf(configs);
    }

    public void validate() {
        if (workloadId == null || workloadId.isBlank()) {
            throw new IllegalArgumentException("workload_id is required");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("client_id is required");
        }
        if (configs.isEmpty()) {
            throw new IllegalArgumentException("at least one candidate config is required");
        }
        Set<CandidateConfig> distinct = new HashSet<>();
        Set<String> labels = new HashSet<>();
        for (CandidateConfig config : configs) {
            config.validate();
            if (!distinct.add(config)) {
                throw new IllegalArgumentException("duplicate candidate config " + config.label());
            }
            if (!labels.add(config.label())) {
                throw new IllegalArgumentException("candidate label " + config.label()
                        + " is shared by several configs; give each a distinct tag");
            }
        }
    }
}
