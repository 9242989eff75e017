package com.dataflywheel.scoring;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class ReportWriter {
    static final String REPORT_FILE = "report.json";

    private static final int BAR_WIDTH = 28;
    private static final int GROUP_GAP = 36;
    private static final int CHART_HEIGHT = 240;
    private static final int MARGIN = 48;

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    /**
     * Writes {@code report.json} and the comparison plot into {@code directory}; returns the report path.
     */
    public Path write(Path directory, ReportArtifact report) throws IOException {
        Files.createDirectories(directory);
        Path reportPath = directory.resolve(REPORT_FILE);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
        Files.writeString(directory.resolve(report.comparisonPlot()), renderComparisonSvg(report), StandardCharsets.UTF_8);
        return reportPath;
    }

    public ReportArtifact read(Path reportPath) throws IOException {
        return objectMapper.readValue(reportPath.toFile(), ReportArtifact.class);
    }

    String renderComparisonSvg(ReportArtifact report) {
        List<Bar> bars = new ArrayList<>();
        bars.add(new Bar("baseline", report.baseline().aggregateScore(), "#4c566a"));
        for (CandidateReport candidate : report.candidates()) {
            bars.add(new Bar(candidate.label() + " pre", candidate.preScore(), "#5e81ac"));
            if (candidate.customizationEnabled()) {
                bars.add(new Bar(candidate.label() + " post", candidate.postScore(), "#a3be8c"));
            }
        }

        int width = MARGIN * 2 + bars.size() * (BAR_WIDTH + GROUP_GAP);
        int height = CHART_HEIGHT + MARGIN * 3;
        double thresholdY = yFor(report.baseline().aggregateScore() - report.tolerance());

        StringBuilder svg = new StringBuilder();
        svg.append(String.format(Locale.ROOT,
                "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"%d\" height=\"%d\" font-family=\"sans-serif\" font-size=\"11\">%n",
                width, height));
        svg.append(String.format(Locale.ROOT,
                "  <line x1=\"%d\" y1=\"%d\" x2=\"%d\" y2=\"%d\" stroke=\"#000\"/>%n",
                MARGIN, MARGIN + CHART_HEIGHT, width - MARGIN, MARGIN + CHART_HEIGHT));
        svg.append(String.format(Locale.ROOT,
                "  <line x1=\"%d\" y1=\"%.1f\" x2=\"%d\" y2=\"%.1f\" stroke=\"#bf616a\" stroke-dasharray=\"4 3\"/>%n",
                MARGIN, thresholdY, width - MARGIN, thresholdY));

        int x = MARGIN + GROUP_GAP / 2;
        for (Bar bar : bars) {
            if (bar.score() == null) {
                svg.append(String.format(Locale.ROOT,
                        "  <text x=\"%d\" y=\"%d\" fill=\"#bf616a\">n/a</text>%n", x, MARGIN + CHART_HEIGHT - 4));
            } else {
                double top = yFor(bar.score());
                svg.append(String.format(Locale.ROOT,
                        "  <rect x=\"%d\" y=\"%.1f\" width=\"%d\" height=\"%.1f\" fill=\"%s\"/>%n",
                        x, top, BAR_WIDTH, MARGIN + CHART_HEIGHT - top, bar.color()));
                svg.append(String.format(Locale.ROOT,
                        "  <text x=\"%d\" y=\"%.1f\">%.3f</text>%n", x, top - 4, bar.score()));
            }
            svg.append(String.format(Locale.ROOT,
                    "  <text x=\"%d\" y=\"%d\" transform=\"rotate(30 %d %d)\">%s</text>%n",
                    x, MARGIN + CHART_HEIGHT + 14, x, MARGIN + CHART_HEIGHT + 14, escape(bar.label())));
            x += BAR_WIDTH + GROUP_GAP;
        }
        svg.append("</svg>\n");
        return svg.toString();
    }

    private static double yFor(double score) {
        double clamped = Math.max(0.0, Math.min(1.0, score));
        return MARGIN + CHART_HEIGHT * (1.0 - clamped);
    }

    private static String escape(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private record Bar(String label, Double score, String color) {
    }
}
