package com.dataflywheel.records;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class RecordImporter {
    private static final Logger log = LoggerFactory.getLogger(RecordImporter.class);

    private final RecordStore recordStore;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public RecordImporter(RecordStore recordStore) {
        this.recordStore = recordStore;
    }

    public ImportReport importFile(Path ndjsonPath) throws IOException {
        List<InteractionRecord> records = parse(ndjsonPath);
        int stored = recordStore.append(records);
        ImportReport report = new ImportReport(records.size(), stored, records.size() - stored);
        log.info("records.import file={} read={} stored={} duplicates={}",
                ndjsonPath, report.read(), report.stored(), report.duplicates());
        return report;
    }

    List<InteractionRecord> parse(Path ndjsonPath) throws IOException {
        List<InteractionRecord> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(ndjsonPath, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                records.add(parseLine(line, lineNumber));
            }
        }
        return records;
    }

    private InteractionRecord parseLine(String line, int lineNumber) {
        try {
            InteractionRecord record = objectMapper.readValue(line, InteractionRecord.class);
            record.validate();
            return record;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Line " + lineNumber + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Line " + lineNumber + " is not a valid interaction record: " + e.getMessage(), e);
        }
    }
}
