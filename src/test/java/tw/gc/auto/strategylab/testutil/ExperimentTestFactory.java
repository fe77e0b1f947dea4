package tw.gc.auto.strategylab.testutil;

import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;
import tw.gc.auto.strategylab.services.experiment.ParameterRange;
import tw.gc.auto.strategylab.services.runner.BacktestException;
import tw.gc.auto.strategylab.services.runner.BacktestFunction;
import tw.gc.auto.strategylab.services.runner.BacktestMetrics;
import tw.gc.auto.strategylab.services.runner.RunRecord;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test factory for experiment configurations, backtest functions and run records.
 */
public class ExperimentTestFactory {

    /**
     * Create a grid configuration over the given ranges.
     */
    public static ExperimentConfiguration config(String name, List<String> symbols, ParameterRange... ranges) {
        return builder(name, symbols, ranges).build();
    }

    public static ExperimentConfiguration.ExperimentConfigurationBuilder builder(String name, List<String> symbols,
                                                                                ParameterRange... ranges) {
        return ExperimentConfiguration.builder()
            .name(name)
            .strategy("test_strategy")
            .symbols(symbols)
            .timeframe("1h")
            .parameters(ExperimentConfiguration.rangesOf(ranges));
    }

    public static BacktestMetrics metrics(double sharpe, int trades) {
        return BacktestMetrics.builder()
            .totalReturn(sharpe / 10)
            .maxDrawdown(0.1)
            .sharpeRatio(sharpe)
            .numTrades(trades)
            .winRate(0.5)
            .profitFactor(1.2)
            .build();
    }

    /**
     * Backtest whose sharpe ratio peaks where {@code parameter} equals {@code peak}.
     */
    public static BacktestFunction peakAt(String parameter, double peak) {
        return (symbol, timeframe, parameters, config) -> {
            double x = ((Number) parameters.get(parameter)).doubleValue();
            return metrics(2.0 - Math.abs(x - peak) / 10.0, 20);
        };
    }

    /**
     * Backtest that always fails, counting its calls.
     */
    public static BacktestFunction alwaysFailing(AtomicInteger calls) {
        return (symbol, timeframe, parameters, config) -> {
            calls.incrementAndGet();
            throw new BacktestException("no data for " + symbol);
        };
    }

    public static RunRecord completedRun(String runId, Map<String, Object> parameters, BacktestMetrics metrics) {
        RunRecord run = new RunRecord(runId, "batch0", "exp", "BTCUSDT", parameters);
        run.markRunning();
        run.recordAttempt();
        run.markCompleted(metrics);
        return run;
    }

    public static RunRecord failedRun(String runId, Map<String, Object> parameters, String error) {
        RunRecord run = new RunRecord(runId, "batch0", "exp", "BTCUSDT", parameters);
        run.markRunning();
        run.recordAttempt();
        run.markFailed(error);
        return run;
    }
}
