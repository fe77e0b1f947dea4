package tw.gc.auto.strategylab.services.walkforward;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.Builder;
import tw.gc.auto.strategylab.enums.SearchMode;
import tw.gc.auto.strategylab.services.runner.BacktestMetrics;

/**
 * Configuration for walk-forward validation.
 *
 * @param trainMonths Length of each training (in-sample) period
 * @param testMonths Length of each test (out-of-sample) period
 * @param stepMonths How far consecutive windows advance
 * @param metric Metric optimized on training and compared out of sample
 * @param maximize Whether a higher metric is better
 * @param minTrades Trades a winning assignment needs across all symbols of a training period
 * @param recommendationThreshold Robustness score from which a strategy is recommended
 * @param searchMode Search strategy used on each training period
 */
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WalkForwardConfig(
    int trainMonths,
    int testMonths,
    int stepMonths,
    String metric,
    boolean maximize,
    int minTrades,
    double recommendationThreshold,
    SearchMode searchMode
) {
    public static final int DEFAULT_TRAIN_MONTHS = 6;
    public static final int DEFAULT_TEST_MONTHS = 2;
    public static final int DEFAULT_STEP_MONTHS = 2;
    public static final int DEFAULT_MIN_TRADES = 5;
    public static final double DEFAULT_RECOMMENDATION_THRESHOLD = 70.0;

    public WalkForwardConfig {
        if (trainMonths < 1) {
            throw new IllegalArgumentException("trainMonths must be >= 1, got: " + trainMonths);
        }
        if (testMonths < 1) {
            throw new IllegalArgumentException("testMonths must be >= 1, got: " + testMonths);
        }
        if (stepMonths < 1) {
            throw new IllegalArgumentException("stepMonths must be >= 1, got: " + stepMonths);
        }
        if (minTrades < 0) {
            throw new IllegalArgumentException("minTrades must be >= 0, got: " + minTrades);
        }
        if (recommendationThreshold < 0 || recommendationThreshold > 100) {
            throw new IllegalArgumentException("recommendationThreshold must be within [0, 100], got: "
                + recommendationThreshold);
        }
        if (metric == null || metric.isBlank()) {
            metric = BacktestMetrics.SHARPE_RATIO;
        }
        if (searchMode == null) {
            searchMode = SearchMode.GRID;
        }
    }

    public static WalkForwardConfig defaults() {
        return new WalkForwardConfig(
            DEFAULT_TRAIN_MONTHS,
            DEFAULT_TEST_MONTHS,
            DEFAULT_STEP_MONTHS,
            BacktestMetrics.SHARPE_RATIO,
            true,
            DEFAULT_MIN_TRADES,
            DEFAULT_RECOMMENDATION_THRESHOLD,
            SearchMode.GRID
        );
    }

    /**
     * Returns {@code true} when {@code value} lies on the favourable side of zero.
     */
    public boolean isFavourable(double value) {
        return maximize ? value > 0 : value < 0;
    }

    public boolean isBetter(double candidate, double current) {
        return maximize ? candidate > current : candidate < current;
    }
}
