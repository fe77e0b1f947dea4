package tw.gc.auto.strategylab.services.search;

import java.io.IOException;
import java.util.List;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.strategylab.enums.SearchMode;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;
import tw.gc.auto.strategylab.services.experiment.ParameterExpander;
import tw.gc.auto.strategylab.services.experiment.Task;
import tw.gc.auto.strategylab.services.runner.BacktestFunction;
import tw.gc.auto.strategylab.services.runner.BatchRunner;
import tw.gc.auto.strategylab.services.runner.ExperimentResult;

/**
 * Runs the configuration's whole expansion as one batch.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GridSearchStrategy implements SearchStrategy {

    private final ParameterExpander parameterExpander;
    private final BatchRunner batchRunner;

    @Override
    public SearchMode mode() {
        return SearchMode.GRID;
    }

    @Override
    public ExperimentResult search(ExperimentConfiguration config, BacktestFunction backtest, SearchOptions options)
            throws IOException {
        List<Task> tasks = parameterExpander.expandTasks(config, options.random());
        log.info("🔍 Grid search over {} tasks for {}", tasks.size(), config.getExperimentId());
        return batchRunner.run(config, tasks, backtest, options.applyTo(batchRunner.getDefaultOptions()));
    }
}
