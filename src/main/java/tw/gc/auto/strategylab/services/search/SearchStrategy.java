package tw.gc.auto.strategylab.services.search;

import java.io.IOException;

import tw.gc.auto.strategylab.enums.SearchMode;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;
import tw.gc.auto.strategylab.services.runner.BacktestFunction;
import tw.gc.auto.strategylab.services.runner.ExperimentResult;

/**
 * Decides which parameter assignments of an experiment get evaluated.
 */
public interface SearchStrategy {

    SearchMode mode();

    /**
     * Evaluates assignments of {@code config} and returns every run it made.
     *
     * @throws IOException if run records cannot be persisted
     */
    ExperimentResult search(ExperimentConfiguration config, BacktestFunction backtest, SearchOptions options)
        throws IOException;
}
