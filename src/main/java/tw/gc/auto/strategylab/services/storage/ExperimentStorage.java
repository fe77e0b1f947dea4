package tw.gc.auto.strategylab.services.storage;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfigurationLoader;
import tw.gc.auto.strategylab.services.runner.ExperimentResult;
import tw.gc.auto.strategylab.services.runner.RunRecord;
import tw.gc.auto.strategylab.services.walkforward.WalkForwardReport;

/**
 * File-system persistence for experiment results.
 *
 * <pre>
 * &lt;results-dir&gt;/&lt;experiment-id&gt;/
 *     runs.jsonl                 one run record per line, append-only
 *     summary.json               configuration, totals, statistics, best run, all runs
 *     config.yaml                the experiment document
 *     walk-forward-report.json   walk-forward report, when one was produced
 * </pre>
 *
 * <p>Appends are serialized and every append is flushed before returning, so the run log
 * can be tailed while an experiment is still running.
 */
@Slf4j
public class ExperimentStorage {

    public static final String RUN_LOG = "runs.jsonl";
    public static final String SUMMARY = "summary.json";
    public static final String CONFIG = "config.yaml";
    public static final String WALK_FORWARD_REPORT = "walk-forward-report.json";

    private final Path baseDir;
    private final ObjectMapper objectMapper;
    private final ExperimentConfigurationLoader configurationLoader;

    public ExperimentStorage(Path baseDir, ObjectMapper objectMapper, ExperimentConfigurationLoader configurationLoader) {
        this.baseDir = baseDir;
        this.objectMapper = objectMapper;
        this.configurationLoader = configurationLoader;
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public Path experimentDir(String experimentId) {
        return baseDir.resolve(experimentId);
    }

    public Path runLogPath(String experimentId) {
        return experimentDir(experimentId).resolve(RUN_LOG);
    }

    /**
     * Appends run records to the experiment's run log, one JSON object per line.
     */
    public synchronized void appendRuns(String experimentId, List<RunRecord> runs) throws IOException {
        if (runs.isEmpty()) {
            return;
        }
        Path path = runLogPath(experimentId);
        Files.createDirectories(path.getParent());
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (RunRecord run : runs) {
                writer.write(objectMapper.writeValueAsString(run));
                writer.newLine();
            }
            writer.flush();
        }
        log.debug("Appended {} runs to {}", runs.size(), path);
    }

    /**
     * Replays the run log. Every line that cannot be parsed is skipped with a warning, wherever
     * it sits: a trailing line still being written by a concurrent writer, or a line left cut
     * off by an interrupted writer before later appends resumed the log.
     *
     * @return the records in log order, empty if nothing was logged yet
     */
    public List<RunRecord> readRuns(String experimentId) throws IOException {
        Path path = runLogPath(experimentId);
        List<RunRecord> runs = new ArrayList<>();
        if (!Files.exists(path)) {
            return runs;
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    runs.add(objectMapper.readValue(line, RunRecord.class));
                } catch (JsonProcessingException e) {
                    log.warn("⚠️ Skipping unreadable line {} of {}: {}", lineNumber, path, e.getOriginalMessage());
                }
            }
        }
        return runs;
    }

    /**
     * Writes {@code summary.json} and {@code config.yaml} for a finished experiment.
     *
     * @return path of the summary document
     */
    public Path saveSummary(ExperimentResult result) throws IOException {
        Path dir = experimentDir(result.getExperimentId());
        Files.createDirectories(dir);

        List<RunRecord> runs = runsOf(result);

        ObjectNode summary = objectMapper.createObjectNode();
        summary.put("experiment_id", result.getExperimentId());
        summary.set("configuration", configurationLoader.toDocument(result.getConfiguration()));
        ObjectNode totals = summary.putObject("totals");
        totals.put("requested", result.getRequestedRuns());
        totals.put("completed", result.getCompletedRuns());
        totals.put("failed", result.getFailedRuns());
        totals.put("cancelled", result.getCancelledRuns());
        summary.put("aborted", result.isAborted());
        summary.set("statistics", objectMapper.valueToTree(result.statistics()));
        summary.put("ranking_metric", result.getRankingMetric());
        summary.put("maximize", result.isMaximize());
        result.bestRun().ifPresentOrElse(
            best -> summary.put("best_run_id", best.getRunId()),
            () -> summary.putNull("best_run_id"));
        ArrayNode batchIds = summary.putArray("batch_ids");
        result.getBatchIds().forEach(batchIds::add);
        summary.put("started_at", result.getStartedAt() != null ? result.getStartedAt().toString() : null);
        summary.put("completed_at", result.getCompletedAt() != null ? result.getCompletedAt().toString() : null);
        summary.put("duration_seconds", result.getDuration().toMillis() / 1000.0);
        summary.set("runs", objectMapper.valueToTree(runs));

        Path summaryPath = dir.resolve(SUMMARY);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(summaryPath.toFile(), summary);
        configurationLoader.save(result.getConfiguration(), dir.resolve(CONFIG));
        log.info("💾 Saved summary of {} ({} runs) to {}", result.getExperimentId(), runs.size(), summaryPath);
        return summaryPath;
    }

    /**
     * Rebuilds a result from a persisted summary.
     *
     * @throws NoSuchFileException if no summary exists for the experiment
     */
    public ExperimentResult loadSummary(String experimentId) throws IOException {
        Path path = experimentDir(experimentId).resolve(SUMMARY);
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "No summary for experiment " + experimentId);
        }
        JsonNode root = objectMapper.readTree(path.toFile());
        ExperimentConfiguration configuration = configurationLoader.fromDocument(root.get("configuration"));
        List<RunRecord> runs = new ArrayList<>();
        for (JsonNode node : root.path("runs")) {
            runs.add(objectMapper.treeToValue(node, RunRecord.class));
        }
        return ExperimentResult.restore(configuration, runs,
            root.path("ranking_metric").asText(),
            root.path("maximize").asBoolean(true),
            root.path("totals").path("requested").asInt(runs.size()),
            root.path("aborted").asBoolean(false),
            instant(root.get("started_at")),
            instant(root.get("completed_at")));
    }

    public Path saveWalkForwardReport(String experimentId, WalkForwardReport report) throws IOException {
        Path dir = experimentDir(experimentId);
        Files.createDirectories(dir);
        Path path = dir.resolve(WALK_FORWARD_REPORT);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), report);
        log.info("💾 Saved walk-forward report to {}", path);
        return path;
    }

    /**
     * All records of a result: the retained ones, or those of its batches replayed from the run log.
     */
    public List<RunRecord> runsOf(ExperimentResult result) throws IOException {
        if (result.isRunsRetained()) {
            return result.getRuns();
        }
        Set<String> batches = new HashSet<>(result.getBatchIds());
        List<RunRecord> runs = new ArrayList<>();
        for (RunRecord run : readRuns(result.getExperimentId())) {
            if (batches.contains(run.getBatchId())) {
                runs.add(run);
            }
        }
        return runs;
    }

    private static Instant instant(JsonNode node) {
        return node == null || node.isNull() ? null : Instant.parse(node.asText());
    }
}
