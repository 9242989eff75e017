package com.dataflywheel.scoring;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.dataflywheel.job.CandidateConfig;
import com.dataflywheel.job.CandidateResult;
import com.dataflywheel.job.CandidateStage;

import static com.dataflywheel.scoring.ScoringFixtures.result;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteReadableReportAndComparisonPlot() throws Exception {
        CandidateConfig candidate = new CandidateConfig("small-8b", 8192, 1, "20Gi", null, true);
        ReportArtifact report = new ScoringAggregator(new PromotionPolicy(0.05)).aggregate(
                result("base-70b", 0.9),
                List.of(new CandidateResult(candidate, CandidateStage.FAILED, result("small-8b", 0.8), null, null, null)));
        ReportWriter writer = new ReportWriter();

        Path reportPath = writer.write(tempDir.resolve("jobs/j1"), report);

        assertEquals(tempDir.resolve("jobs/j1/report.json"), reportPath);
        assertEquals(report, writer.read(reportPath));
        String json = Files.readString(reportPath);
        assertTrue(json.contains("\"generatedAt\" : \"2026-01-05T10:00:00Z\""), json);

        String svg = Files.readString(tempDir.resolve("jobs/j1").resolve(ReportArtifact.COMPARISON_PLOT_FILE));
        assertTrue(svg.startsWith("<svg"));
        assertTrue(svg.contains("0.900"));
        assertTrue(svg.contains("small-8b pre"));
        assertTrue(svg.contains("small-8b post"));
        assertTrue(svg.contains("n/a"));
        assertTrue(svg.contains("stroke-dasharray"));
    }
}
