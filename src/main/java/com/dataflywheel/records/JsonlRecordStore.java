package com.dataflywheel.records;

import java.io.BufferedWriter;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataflywheel.exception.RecordStoreUnavailableException;
import com.dataflywheel.exception.RecordsNotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class JsonlRecordStore implements RecordStore {
    private static final Logger log = LoggerFactory.getLogger(JsonlRecordStore.class);

    private final Path root;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public JsonlRecordStore(Path root) {
        this.root = root;
    }

    @Override
    public List<InteractionRecord> fetch(String workloadId, String clientId, TimeRange range) {
        TimeRange effectiveRange = range == null ? TimeRange.ALL : range;
        Path file = fileFor(workloadId, clientId);
        List<InteractionRecord> records;
        try {
            records = readAll(file);
        } catch (IOException e) {
            throw new RecordStoreUnavailableException("Record store unreadable at " + file + ": " + e.getMessage(), e);
        }

        List<InteractionRecord> matching = records.stream()
                .filter(record -> effectiveRange.contains(record.timestamp()))
                .sorted(Comparator.comparingLong(InteractionRecord::timestamp))
                .toList();
        if (matching.isEmpty()) {
            throw new RecordsNotFoundException("No records stored for workload_id=" + workloadId
                    + " client_id=" + clientId);
        }
        log.debug("records.fetch workloadId={} clientId={} count={}", workloadId, clientId, matching.size());
        return matching;
    }

    @Override
    public synchronized int append(List<InteractionRecord> records) {
        Map<Path, List<InteractionRecord>> byFile = new LinkedHashMap<>();
        for (InteractionRecord record : records) {
            record.validate();
            byFile.computeIfAbsent(fileFor(record.workloadId(), record.clientId()), ignored -> new ArrayList<>()).add(record);
        }

        int stored = 0;
        for (Map.Entry<Path, List<InteractionRecord>> entry : byFile.entrySet()) {
            try {
                stored += appendToFile(entry.getKey(), entry.getValue());
            } catch (IOException e) {
                throw new RecordStoreUnavailableException("Record store unwritable at " + entry.getKey() + ": " + e.getMessage(), e);
            }
        }
        return stored;
    }

    private int appendToFile(Path file, List<InteractionRecord> incoming) throws IOException {
        Set<Long> existing = new HashSet<>();
        for (InteractionRecord record : readAll(file)) {
            existing.add(record.timestamp());
        }
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }

        int stored = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (InteractionRecord record : incoming) {
                if (!existing.add(record.timestamp())) {
                    continue;
                }
                writer.write(objectMapper.writeValueAsString(record));
                writer.newLine();
                stored++;
            }
        }
        return stored;
    }

    private List<InteractionRecord> readAll(Path file) throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0L) {
            return List.of();
        }
        List<InteractionRecord> records = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                records.add(objectMapper.readValue(line, InteractionRecord.class));
            }
        }
        return records;
    }

    private Path fileFor(String workloadId, String clientId) {
        return root.resolve(encode(workloadId)).resolve(encode(clientId) + ".jsonl");
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
