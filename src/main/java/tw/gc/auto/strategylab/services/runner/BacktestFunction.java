package tw.gc.auto.strategylab.services.runner;

import java.util.Map;

import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;

/**
 * The backtest collaborator. Implementations must be safe to call concurrently and repeatedly.
 */
@FunctionalInterface
public interface BacktestFunction {

    /**
     * Runs one backtest.
     *
     * @param symbol Instrument to test
     * @param timeframe Bar timeframe, e.g. "1h"
     * @param parameters Concrete strategy parameters
     * @param config Owning experiment, carrying execution defaults and the optional period
     * @return Metrics of the run
     * @throws BacktestException when the run cannot produce metrics
     */
    BacktestMetrics run(String symbol, String timeframe, Map<String, Object> parameters,
                        ExperimentConfiguration config) throws BacktestException;
}
