package com.dataflywheel.job;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.dataflywheel.scoring.ReportArtifact;
import com.dataflywheel.scoring.ReportWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class JobSnapshotStore {
    static final String SNAPSHOT_FILE = "job.json";

    private final Path jobsDir;
    private final ReportWriter reportWriter;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public JobSnapshotStore(Path workDir) {
        this(workDir, new ReportWriter());
    }

    JobSnapshotStore(Path workDir, ReportWriter reportWriter) {
        this.jobsDir = workDir.resolve("jobs");
        this.reportWriter = reportWriter;
    }

    public Path jobDir(String jobId) {
        return jobsDir.resolve(jobId);
    }

    public synchronized void persist(FlywheelJob job) throws IOException {
        Path dir = jobDir(job.jobId());
        Files.createDirectories(dir);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(dir.resolve(SNAPSHOT_FILE).toFile(), job.snapshot());
    }

    public boolean exists(String jobId) {
        return Files.exists(jobDir(jobId).resolve(SNAPSHOT_FILE));
    }

    public synchronized FlywheelJobSnapshot load(String jobId) throws IOException {
        Path file = jobDir(jobId).resolve(SNAPSHOT_FILE);
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("No snapshot for job " + jobId + " at " + file);
        }
        return objectMapper.readValue(file.toFile(), FlywheelJobSnapshot.class);
    }

    public Path writeReport(String jobId, ReportArtifact report) throws IOException {
        return reportWriter.write(jobDir(jobId), report);
    }

    public ReportArtifact readReport(String reportArtifactRef) throws IOException {
        return reportWriter.read(Path.of(reportArtifactRef));
    }
}
