package com.dataflywheel.records;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatResponse(String id, String model, List<Choice> choices) {

    public ChatResponse {
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    public static ChatResponse of(String model, ChatMessage message) {
        return new ChatResponse(null, model, List.of(new Choice(0, message, "stop")));
    }

    @JsonIgnore
    public ChatMessage message() {
        if (choices.isEmpty() || choices.get(0).message() == null) {
            throw new IllegalStateException("response carries no completion choice");
        }
        return choices.get(0).message();
    }

    public void validate() {
        if (choices.isEmpty() || choices.get(0).message() == null) {
            throw new IllegalArgumentException("response.choices must contain a message");
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Choice(int index, ChatMessage message, @JsonProperty("finish_reason") String finishReason) {
    }
}
