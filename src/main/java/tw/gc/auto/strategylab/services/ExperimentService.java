package tw.gc.auto.strategylab.services;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.strategylab.services.analysis.AnalysisReport;
import tw.gc.auto.strategylab.services.analysis.ResultAnalyzer;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfigurationLoader;
import tw.gc.auto.strategylab.services.experiment.ParameterExpander;
import tw.gc.auto.strategylab.services.experiment.Task;
import tw.gc.auto.strategylab.services.runner.BacktestFunction;
import tw.gc.auto.strategylab.services.runner.BatchRunner;
import tw.gc.auto.strategylab.services.runner.ExperimentResult;
import tw.gc.auto.strategylab.services.search.SearchOptions;
import tw.gc.auto.strategylab.services.search.SearchStrategies;
import tw.gc.auto.strategylab.services.storage.ExperimentStorage;
import tw.gc.auto.strategylab.services.walkforward.WalkForwardConfig;
import tw.gc.auto.strategylab.services.walkforward.WalkForwardOrchestrator;
import tw.gc.auto.strategylab.services.walkforward.WalkForwardResult;

/**
 * Entry point for running, optimizing and validating experiments with the configured defaults.
 * Every finished experiment is persisted through {@link ExperimentStorage}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExperimentService {

    private final ExperimentConfigurationLoader configurationLoader;
    private final ParameterExpander parameterExpander;
    private final BatchRunner batchRunner;
    private final SearchStrategies searchStrategies;
    private final WalkForwardOrchestrator walkForwardOrchestrator;
    private final ResultAnalyzer resultAnalyzer;
    private final ExperimentStorage storage;
    private final SearchOptions searchOptions;
    private final WalkForwardConfig walkForwardConfig;

    public ExperimentResult runExperiment(Path configPath, BacktestFunction backtest) throws IOException {
        return runExperiment(configurationLoader.load(configPath), backtest);
    }

    /**
     * Expands the configuration and runs every task once.
     */
    public ExperimentResult runExperiment(ExperimentConfiguration config, BacktestFunction backtest)
            throws IOException {
        List<Task> tasks = parameterExpander.expandTasks(config);
        log.info("🚀 Running experiment {} ({} tasks)", config.getExperimentId(), tasks.size());
        ExperimentResult result = batchRunner.run(config, tasks, backtest);
        storage.saveSummary(result);
        return result;
    }

    public ExperimentResult optimize(ExperimentConfiguration config, BacktestFunction backtest) throws IOException {
        return optimize(config, backtest, searchOptions);
    }

    public ExperimentResult optimize(ExperimentConfiguration config, BacktestFunction backtest, SearchOptions options)
            throws IOException {
        ExperimentResult result = searchStrategies.search(config, backtest, options);
        storage.saveSummary(result);
        result.bestRun().ifPresentOrElse(
            best -> log.info("🏆 Best of {}: {} = {} with {}", result.getExperimentId(), options.metric(),
                best.metric(options.metric()).orElse(Double.NaN), best.getParameters()),
            () -> log.warn("⚠️ No completed run in {}", result.getExperimentId()));
        return result;
    }

    public WalkForwardResult walkForward(ExperimentConfiguration config, BacktestFunction backtest) throws IOException {
        return walkForwardOrchestrator.run(config, backtest, walkForwardConfig, searchOptions);
    }

    public WalkForwardResult walkForward(ExperimentConfiguration config, BacktestFunction backtest,
                                         WalkForwardConfig walkForward) throws IOException {
        return walkForwardOrchestrator.run(config, backtest, walkForward, searchOptions);
    }

    public ExperimentResult loadResult(String experimentId) throws IOException {
        return storage.loadSummary(experimentId);
    }

    public AnalysisReport analyze(ExperimentResult result) throws IOException {
        return resultAnalyzer.analyze(result);
    }
}
