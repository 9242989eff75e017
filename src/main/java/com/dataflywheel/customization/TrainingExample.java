package com.dataflywheel.customization;

import java.util.ArrayList;
import java.util.List;

import com.dataflywheel.records.ChatMessage;
import com.dataflywheel.records.InteractionRecord;
import com.dataflywheel.records.ToolDefinition;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TrainingExample(
        List<ChatMessage> messages,
        List<ToolDefinition> tools,
        @JsonProperty("source_record_id") String sourceRecordId) {

    public static TrainingExample from(InteractionRecord record) {
        List<ChatMessage> messages = new ArrayList<>(record.request().messages());
        messages.add(record.response().message());
        return new TrainingExample(List.copyOf(messages), record.request().tools(), record.recordId());
    }
}
