package com.raditha.hygiene.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.hygiene.workflow.PipelineResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports per-pass statistics of normalization runs to CSV and JSON for tracking how often each
 * rewrite fires across a code base.
 */
public class PipelineMetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Metrics aggregated over every normalized unit.
     */
    public record RunMetrics(
            String projectName,
            LocalDateTime timestamp,
            int totalUnits,
            int totalIterations,
            int totalChanges,
            List<PassMetrics> passes) {
    }

    /**
     * Aggregated statistics for one pass.
     */
    public record PassMetrics(
            String passName,
            int invocations,
            int changes,
            long totalNanos) {
    }

    /**
     * Build aggregated metrics from pipeline results, one per normalized unit.
     */
    public RunMetrics buildMetrics(List<PipelineResult> results, String projectName) {
        Map<String, long[]> perPass = new LinkedHashMap<>();
        for (PipelineResult result : results) {
            for (PipelineResult.PassRun run : result.runs()) {
                long[] acc = perPass.computeIfAbsent(run.name(), k -> new long[3]);
                acc[0]++;
                acc[1] += run.changed() ? 1 : 0;
                acc[2] += run.nanos();
            }
        }
        List<PassMetrics> passes = new ArrayList<>();
        int totalChanges = 0;
        for (Map.Entry<String, long[]> e : perPass.entrySet()) {
            long[] acc = e.getValue();
            passes.add(new PassMetrics(e.getKey(), (int) acc[0], (int) acc[1], acc[2]));
            totalChanges += (int) acc[1];
        }
        int totalIterations = results.stream().mapToInt(PipelineResult::iterations).sum();
        return new RunMetrics(
                projectName,
                LocalDateTime.now(),
                results.size(),
                totalIterations,
                totalChanges,
                passes);
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(RunMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Run Summary\n");
        csv.append("timestamp,project,total_units,total_iterations,total_changes\n");
        csv.append(String.format("%s,%s,%d,%d,%d\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                metrics.projectName(),
                metrics.totalUnits(),
                metrics.totalIterations(),
                metrics.totalChanges()));

        csv.append("\n");

        csv.append("# Per-Pass Metrics\n");
        csv.append("pass,invocations,changes,total_ms\n");
        for (PassMetrics pass : metrics.passes()) {
            csv.append(String.format("%s,%d,%d,%.3f\n",
                    pass.passName(),
                    pass.invocations(),
                    pass.changes(),
                    pass.totalNanos() / 1_000_000.0));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(RunMetrics metrics, Path outputPath) throws IOException {
        mapper.writeValue(outputPath.toFile(), metrics);
    }

    /**
     * Read metrics written by {@link #exportToJson}.
     */
    public RunMetrics readJson(Path inputPath) throws IOException {
        return mapper.readValue(inputPath.toFile(), RunMetrics.class);
    }
}
