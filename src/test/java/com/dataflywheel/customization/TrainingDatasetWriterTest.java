package com.dataflywheel.customization;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.dataflywheel.records.InteractionRecord;
import com.dataflywheel.records.TestRecords;
import com.dataflywheel.records.ToolCall;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TrainingDatasetWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteTrainAndValidationFilesInChatShape() throws Exception {
        InteractionRecord chat = TestRecords.freeText(1_000, "w1", "c1", "hello", "hi there");
        InteractionRecord tool = TestRecords.toolCalling(1_001, "w1", "c1", "weather in Paris?",
                ToolCall.function("get_weather", "{\"city\":\"Paris\"}"));
        DatasetSplit split = new DatasetSplit(List.of(chat, tool), List.of(chat), List.of(tool));
        Path datasetDir = tempDir.resolve("jobs/j1/datasets");

        String ref = new TrainingDatasetWriter().write(datasetDir, split);

        assertEquals(datasetDir.toAbsolutePath().normalize().toString(), ref);
        List<String> train = Files.readAllLines(datasetDir.resolve(TrainingDatasetWriter.TRAIN_FILE), StandardCharsets.UTF_8);
        List<String> validation = Files.readAllLines(datasetDir.resolve(TrainingDatasetWriter.VALIDATION_FILE), StandardCharsets.UTF_8);
        assertEquals(1, train.size());
        assertEquals(1, validation.size());

        ObjectMapper mapper = new ObjectMapper();
        JsonNode example = mapper.readTree(train.get(0));
        assertEquals("user", example.get("messages").get(0).get("role").asText());
        assertEquals("hi there", example.get("messages").get(1).get("content").asText());
        assertEquals(chat.recordId(), example.get("source_record_id").asText());

        JsonNode toolExample = mapper.readTree(validation.get(0));
        assertEquals("get_weather",
                toolExample.get("messages").get(1).get("tool_calls").get(0).get("function").get("name").asText());
    }
}
