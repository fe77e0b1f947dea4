package tw.gc.auto.strategylab.services.search;

import java.util.Random;

import lombok.Builder;
import tw.gc.auto.strategylab.enums.SearchMode;
import tw.gc.auto.strategylab.services.runner.BacktestMetrics;
import tw.gc.auto.strategylab.services.runner.RunnerOptions;

/**
 * Search configuration shared by every strategy.
 *
 * @param mode Strategy to use
 * @param metric Objective metric name
 * @param maximize Whether a higher objective is better
 * @param earlyStopping Stop random search once batches stop improving
 * @param patience Tolerated consecutive non-improving batches
 * @param minImprovement Improvement a batch must exceed to count as progress
 * @param batchSize Tasks per random-search batch
 * @param initialPoints Random evaluations before the surrogate takes over
 * @param callBudget Evaluations of model-based search; {@code null} uses max_combinations or 100
 * @param candidatePoolSize Unobserved points scored by the acquisition function per step
 * @param seed Seed for every random draw; {@code null} for a fresh draw each time
 */
@Builder(toBuilder = true)
public record SearchOptions(
    SearchMode mode,
    String metric,
    boolean maximize,
    boolean earlyStopping,
    int patience,
    double minImprovement,
    int batchSize,
    int initialPoints,
    Integer callBudget,
    int candidatePoolSize,
    Long seed
) {
    public static final int DEFAULT_CALL_BUDGET = 100;

    public SearchOptions {
        if (mode == null) {
            mode = SearchMode.GRID;
        }
        if (metric == null || metric.isBlank()) {
            metric = BacktestMetrics.SHARPE_RATIO;
        }
        if (patience < 0) {
            throw new IllegalArgumentException("patience must be >= 0, got: " + patience);
        }
        if (minImprovement < 0) {
            throw new IllegalArgumentException("minImprovement must be >= 0, got: " + minImprovement);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got: " + batchSize);
        }
        if (initialPoints < 1) {
            throw new IllegalArgumentException("initialPoints must be >= 1, got: " + initialPoints);
        }
        if (callBudget != null && callBudget < 1) {
            throw new IllegalArgumentException("callBudget must be >= 1, got: " + callBudget);
        }
        if (candidatePoolSize < 1) {
            throw new IllegalArgumentException("candidatePoolSize must be >= 1, got: " + candidatePoolSize);
        }
    }

    public static SearchOptions defaults() {
        return new SearchOptions(SearchMode.GRID, BacktestMetrics.SHARPE_RATIO, true, false, 10, 0.01, 20, 10,
            null, 500, null);
    }

    public SearchOptions withMode(SearchMode searchMode) {
        return toBuilder().mode(searchMode).build();
    }

    /**
     * Runner options ranking runs by this search's objective.
     */
    public RunnerOptions applyTo(RunnerOptions runnerOptions) {
        return runnerOptions.toBuilder().rankingMetric(metric).maximize(maximize).build();
    }

    public Random random() {
        return seed != null ? new Random(seed) : new Random();
    }

    /**
     * Returns {@code true} when {@code candidate} beats {@code current} in the search direction.
     */
    public boolean isBetter(double candidate, double current) {
        return maximize ? candidate > current : candidate < current;
    }
}
