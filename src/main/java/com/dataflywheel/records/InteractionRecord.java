package com.dataflywheel.records;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InteractionRecord(
        long timestamp,
        @JsonProperty("workload_id") String workloadId,
        @JsonProperty("client_id") String clientId,
        ChatRequest request,
        ChatResponse response) {

    @JsonIgnore
    public String recordId() {
        return workloadId + ":" + clientId + ":" + timestamp;
    }

    @JsonIgnore
    public boolean isToolCalling() {
        return response != null
                && !response.choices().isEmpty()
                && response.choices().get(0).message() != null
                && response.choices().get(0).message().hasToolCalls();
    }

    public void validate() {
        if (timestamp <= 0) {
            throw new IllegalArgumentException("timestamp must be positive epoch seconds");
        }
        if (workloadId == null || workloadId.isBlank()) {
            throw new IllegalArgumentException("workload_id is required");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("client_id is required");
        }
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        if (response == null) {
            throw new IllegalArgumentException("response is required");
        }
        request.validate();
        response.validate();
    }
}
