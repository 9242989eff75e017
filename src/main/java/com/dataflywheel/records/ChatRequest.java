package com.dataflywheel.records;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ChatRequest(String model, List<ChatMessage> messages, List<ToolDefinition> tools) {

    public ChatRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public ChatRequest withModel(String targetModel) {
        return new ChatRequest(targetModel, messages, tools);
    }

    public void validate() {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("request.model is required");
        }
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("request.messages must not be empty");
        }
        for (ChatMessage message : messages) {
            if (message.role() == null || message.role().isBlank()) {
                throw new IllegalArgumentException("request.messages[].role is required");
            }
        }
    }
}
