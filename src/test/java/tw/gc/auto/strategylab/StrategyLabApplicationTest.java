package tw.gc.auto.strategylab;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;

import tw.gc.auto.strategylab.enums.WindowState;
import tw.gc.auto.strategylab.services.ExperimentService;
import tw.gc.auto.strategylab.services.analysis.AnalysisReport;
import tw.gc.auto.strategylab.services.experiment.DocumentFormat;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfigurationLoader;
import tw.gc.auto.strategylab.services.runner.BacktestFunction;
import tw.gc.auto.strategylab.services.runner.ExperimentResult;
import tw.gc.auto.strategylab.services.storage.ExperimentStorage;
import tw.gc.auto.strategylab.services.walkforward.WalkForwardResult;

import static org.assertj.core.api.Assertions.*;
import static tw.gc.auto.strategylab.testutil.ExperimentTestFactory.peakAt;

/**
 * Runs the wired application against a temporary results directory.
 */
@SpringBootTest
class StrategyLabApplicationTest {

    private static final String EXPERIMENT = """
        name: sma sweep
        strategy: sma_cross
        symbols: [BTCUSDT, ETHUSDT]
        timeframe: 1h
        parameters:
          period: {start: 10, stop: 50, step: 10}
        start_date: 2023-01-01
        end_date: 2023-12-01
        """;

    @TempDir
    static Path resultsDir;

    @DynamicPropertySource
    static void labProperties(DynamicPropertyRegistry registry) {
        registry.add("lab.storage.results-dir", () -> resultsDir.toString());
    }

    @Autowired
    private ExperimentService experimentService;

    @Autowired
    private ExperimentConfigurationLoader configurationLoader;

    @Autowired
    private ExperimentStorage storage;

    private final BacktestFunction backtest = peakAt("period", 30);

    @Test
    @DisplayName("should store results under the configured directory")
    void shouldUseConfiguredResultsDir() {
        assertThat(storage.getBaseDir()).isEqualTo(resultsDir);
    }

    @Test
    @DisplayName("should run, persist, reload and analyze an experiment file")
    void shouldRunExperimentFromFile() throws Exception {
        Path file = resultsDir.resolve("sma.yaml");
        Files.writeString(file, EXPERIMENT);

        ExperimentResult result = experimentService.runExperiment(file, backtest);

        assertThat(result.getCompletedRuns()).isEqualTo(10);
        assertThat(result.bestRun()).hasValueSatisfying(best ->
            assertThat(best.getParameters()).containsEntry("period", 30));
        assertThat(storage.experimentDir(result.getExperimentId()).resolve(ExperimentStorage.SUMMARY)).exists();
        assertThat(storage.readRuns(result.getExperimentId()))
            .filteredOn(run -> result.getBatchIds().contains(run.getBatchId()))
            .hasSize(10);

        ExperimentResult reloaded = experimentService.loadResult(result.getExperimentId());
        assertThat(reloaded.getCompletedRuns()).isEqualTo(10);
        assertThat(reloaded.getConfiguration()).isEqualTo(result.getConfiguration());

        AnalysisReport report = experimentService.analyze(reloaded);
        assertThat(report.bestParameters()).containsEntry("period", 30);
        assertThat(report.completedRuns()).isEqualTo(10);
    }

    @Test
    @DisplayName("should optimize with the configured search mode")
    void shouldOptimize() throws Exception {
        ExperimentConfiguration config = configurationLoader.parse(EXPERIMENT, DocumentFormat.YAML);

        ExperimentResult result = experimentService.optimize(config, backtest);

        assertThat(result.getRequestedRuns()).isEqualTo(10);
        assertThat(result.bestValue()).hasValue(2.0);
    }

    @Test
    @DisplayName("should walk forward and save the report")
    void shouldWalkForward() throws Exception {
        ExperimentConfiguration config = configurationLoader.parse(EXPERIMENT, DocumentFormat.YAML);

        WalkForwardResult result = experimentService.walkForward(config, backtest);

        assertThat(result.getWindows()).hasSize(2)
            .allSatisfy(window -> assertThat(window.getState()).isEqualTo(WindowState.VALIDATED));
        assertThat(result.robustParameters()).hasValueSatisfying(params ->
            assertThat(params).containsEntry("period", 30));
        assertThat(storage.experimentDir(config.getExperimentId()).resolve(ExperimentStorage.WALK_FORWARD_REPORT))
            .exists();
    }
}
