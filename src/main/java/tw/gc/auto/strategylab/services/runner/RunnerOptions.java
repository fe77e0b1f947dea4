package tw.gc.auto.strategylab.services.runner;

import java.time.Duration;

import lombok.Builder;

/**
 * Batch execution knobs.
 *
 * @param maxWorkers Size of the worker pool
 * @param retryEnabled Whether failed runs are retried
 * @param maxRetries Retries after the first attempt
 * @param retryDelay Base delay; the n-th retry waits {@code n × retryDelay}
 * @param failFast Stop dispatching after the first failed run
 * @param flushEvery Append finished runs to the run log every this many records
 * @param retainRuns Keep flushed runs in memory; when false the run log is authoritative
 * @param rankingMetric Metric used to pick the best run
 * @param maximize Whether a higher ranking metric is better
 */
@Builder(toBuilder = true)
public record RunnerOptions(
    int maxWorkers,
    boolean retryEnabled,
    int maxRetries,
    Duration retryDelay,
    boolean failFast,
    int flushEvery,
    boolean retainRuns,
    String rankingMetric,
    boolean maximize
) {
    public RunnerOptions {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, got: " + maxWorkers);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        if (flushEvery < 1) {
            throw new IllegalArgumentException("flushEvery must be >= 1, got: " + flushEvery);
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be a non-negative duration");
        }
        if (rankingMetric == null || rankingMetric.isBlank()) {
            rankingMetric = BacktestMetrics.SHARPE_RATIO;
        }
    }

    public static RunnerOptions defaults() {
        return new RunnerOptions(4, true, 2, Duration.ofMillis(500), false, 10, true,
            BacktestMetrics.SHARPE_RATIO, true);
    }

    /**
     * Attempts a task gets in total.
     */
    public int maxAttempts() {
        return retryEnabled ? maxRetries + 1 : 1;
    }
}
