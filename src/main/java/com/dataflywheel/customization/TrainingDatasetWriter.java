package com.dataflywheel.customization;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataflywheel.records.InteractionRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class TrainingDatasetWriter {
    private static final Logger log = LoggerFactory.getLogger(TrainingDatasetWriter.class);

    static final String TRAIN_FILE = "train.jsonl";
    static final String VALIDATION_FILE = "val.jsonl";

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    /**
     * Writes the training and validation slices and returns the directory that holds them.
     */
    public String write(Path datasetDir, DatasetSplit split) throws IOException {
        Files.createDirectories(datasetDir);
        writeSlice(datasetDir.resolve(TRAIN_FILE), split.training());
        writeSlice(datasetDir.resolve(VALIDATION_FILE), split.validation());
        log.info("dataset.written dir={} train={} validation={}", datasetDir, split.training().size(), split.validation().size());
        return datasetDir.toAbsolutePath().normalize().toString();
    }

    private void writeSlice(Path file, List<InteractionRecord> records) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (InteractionRecord record : records) {
                writer.write(objectMapper.writeValueAsString(TrainingExample.from(record)));
                writer.newLine();
            }
        }
    }
}
