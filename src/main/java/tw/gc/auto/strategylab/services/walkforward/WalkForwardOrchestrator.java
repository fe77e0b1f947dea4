package tw.gc.auto.strategylab.services.walkforward;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;
import tw.gc.auto.strategylab.services.experiment.InvalidConfigurationException;
import tw.gc.auto.strategylab.services.experiment.ParameterExpander;
import tw.gc.auto.strategylab.services.runner.BacktestFunction;
import tw.gc.auto.strategylab.services.runner.BatchRunner;
import tw.gc.auto.strategylab.services.runner.ExperimentResult;
import tw.gc.auto.strategylab.services.runner.RunRecord;
import tw.gc.auto.strategylab.services.runner.RunnerOptions;
import tw.gc.auto.strategylab.services.search.SearchOptions;
import tw.gc.auto.strategylab.services.search.SearchStrategies;
import tw.gc.auto.strategylab.services.storage.ExperimentStorage;

/**
 * Walk-forward validation of an experiment.
 *
 * <p>For every window, in order:
 * <ol>
 *   <li>Optimize: search the parameter space on the training period only and freeze the best
 *       assignment that traded at least {@code minTrades} times across all symbols</li>
 *   <li>Validate: run the frozen assignment once per symbol on the test period</li>
 * </ol>
 *
 * <p>Windows are processed strictly one after another. A training period may overlap an
 * earlier test period, so nothing learned on one window is carried into the next.
 *
 * <p>Backtest failures stay inside the runs and at worst leave a window unoptimized or
 * unvalidated. Configuration and I/O errors propagate.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WalkForwardOrchestrator {

    private final WindowGenerator windowGenerator;
    private final SearchStrategies searchStrategies;
    private final BatchRunner batchRunner;
    private final OverfittingDetector overfittingDetector;
    private final ExperimentStorage storage;

    public WalkForwardResult run(ExperimentConfiguration config, BacktestFunction backtest,
                                 WalkForwardConfig walkForwardConfig) throws IOException {
        return run(config, backtest, walkForwardConfig, SearchOptions.defaults());
    }

    /**
     * Walks forward over the configuration's own start and end date. The search mode, metric
     * and direction of {@code searchOptions} are replaced by the walk-forward configuration's.
     *
     * @throws InvalidConfigurationException if the configuration has no period
     */
    public WalkForwardResult run(ExperimentConfiguration config, BacktestFunction backtest,
                                 WalkForwardConfig walkForwardConfig, SearchOptions searchOptions) throws IOException {
        if (config.getStartDate() == null || config.getEndDate() == null) {
            throw new InvalidConfigurationException(
                "Walk-forward of %s needs start_date and end_date".formatted(config.getName()));
        }
        return run(config, backtest, config.getStartDate(), config.getEndDate(), walkForwardConfig, searchOptions);
    }

    public WalkForwardResult run(ExperimentConfiguration config, BacktestFunction backtest,
                                 LocalDate start, LocalDate end, WalkForwardConfig walkForwardConfig,
                                 SearchOptions searchOptions) throws IOException {
        List<WalkForwardWindow> windows = windowGenerator.generate(start, end, walkForwardConfig);
        SearchOptions trainOptions = searchOptions.toBuilder()
            .mode(walkForwardConfig.searchMode())
            .metric(walkForwardConfig.metric())
            .maximize(walkForwardConfig.maximize())
            .build();

        log.info("🚀 Walk-forward of {} ({}) over {} → {}: {} windows, train {}m / test {}m / step {}m, {} search on {}",
            config.getName(), config.getStrategy(), start, end, windows.size(),
            walkForwardConfig.trainMonths(), walkForwardConfig.testMonths(), walkForwardConfig.stepMonths(),
            trainOptions.mode(), walkForwardConfig.metric());

        Duration trainDuration = Duration.ZERO;
        Duration testDuration = Duration.ZERO;
        for (WalkForwardWindow window : windows) {
            log.info("📊 Processing {}", window.describe());

            long trainStarted = System.nanoTime();
            optimize(window, config, backtest, walkForwardConfig, trainOptions);
            trainDuration = trainDuration.plusNanos(System.nanoTime() - trainStarted);

            if (!window.isOptimized()) {
                log.warn("⚠️ Window {} not optimized: {}", window.getIndex(), window.getFailureReason());
                continue;
            }

            long testStarted = System.nanoTime();
            validate(window, config, backtest, walkForwardConfig);
            testDuration = testDuration.plusNanos(System.nanoTime() - testStarted);

            if (window.isValidated()) {
                log.info("✅ Window {}: IS {} = {}, OOS {} = {}, params {}", window.getIndex(),
                    walkForwardConfig.metric(), window.trainMetric(walkForwardConfig.metric()).orElse(Double.NaN),
                    walkForwardConfig.metric(), window.testMetric(walkForwardConfig.metric()).orElse(Double.NaN),
                    window.getBestParameters());
            } else {
                log.warn("⚠️ Window {} not validated: {}", window.getIndex(), window.getFailureReason());
            }
        }

        WalkForwardResult result = new WalkForwardResult(config, walkForwardConfig, start, end, windows,
            trainDuration, testDuration);
        WalkForwardReport report = report(result);
        if (storage != null) {
            storage.saveWalkForwardReport(config.getExperimentId(), report);
        }

        log.info("✅ Walk-forward of {} completed: {}/{} windows validated, robustness {} ({}), {}",
            config.getName(), report.validatedWindows(), windows.size(),
            "%.1f".formatted(report.robustness().total()), report.robustness().status(),
            report.recommended() ? "recommended" : "not recommended");
        return result;
    }

    public WalkForwardReport report(WalkForwardResult result) {
        return WalkForwardReport.of(result, overfittingDetector.analyze(result));
    }

    private void optimize(WalkForwardWindow window, ExperimentConfiguration config, BacktestFunction backtest,
                          WalkForwardConfig walkForwardConfig, SearchOptions options) throws IOException {
        ExperimentConfiguration trainConfig = config.withPeriod(window.getTrainStart(), window.getTrainEnd());
        ExperimentResult trained = searchStrategies.search(trainConfig, backtest, options);
        List<AssignmentPerformance> candidates = AssignmentPerformance.aggregate(runsOf(trained));

        String metric = walkForwardConfig.metric();
        Comparator<AssignmentPerformance> byMetric =
            Comparator.comparingDouble(p -> p.metric(metric).getAsDouble());
        var eligible = candidates.stream()
            .filter(p -> p.metric(metric).isPresent())
            .filter(p -> p.totalTrades() >= walkForwardConfig.minTrades());
        Optional<AssignmentPerformance> winner = walkForwardConfig.maximize()
            ? eligible.max(byMetric)
            : eligible.min(byMetric);

        if (winner.isEmpty()) {
            window.recordFailure("No assignment out of %d with a %s and at least %d trades (%d runs completed)"
                .formatted(candidates.size(), metric, walkForwardConfig.minTrades(), trained.getCompletedRuns()));
            return;
        }
        window.markOptimized(winner.get().parameters(), winner.get().metrics(), candidates.size());
    }

    private void validate(WalkForwardWindow window, ExperimentConfiguration config, BacktestFunction backtest,
                          WalkForwardConfig walkForwardConfig) throws IOException {
        ExperimentConfiguration testConfig = config.withPeriod(window.getTestStart(), window.getTestEnd());
        RunnerOptions options = batchRunner.getDefaultOptions().toBuilder()
            .rankingMetric(walkForwardConfig.metric())
            .maximize(walkForwardConfig.maximize())
            .retainRuns(true)
            .build();
        ExperimentResult tested = batchRunner.run(testConfig,
            ParameterExpander.tasksFor(config.getSymbols(), List.of(window.getBestParameters())), backtest, options);

        AssignmentPerformance performance = AssignmentPerformance.of(window.getBestParameters(), tested.getRuns());
        if (performance.completedRuns() == 0) {
            window.recordFailure("All %d test runs failed".formatted(tested.getFailedRuns()));
            return;
        }
        window.markValidated(performance.metrics(), performance.completedRuns());
    }

    private List<RunRecord> runsOf(ExperimentResult result) throws IOException {
        if (result.isRunsRetained() || storage == null) {
            return result.getRuns();
        }
        return storage.runsOf(result);
    }
}
