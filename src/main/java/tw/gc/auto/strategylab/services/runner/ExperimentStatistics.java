package tw.gc.auto.strategylab.services.runner;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import tw.gc.auto.strategylab.enums.StatisticStatus;

/**
 * Aggregate view over the runs of an experiment. Averages and extremes are {@code null}
 * when no run completed, in which case the status is INSUFFICIENT_DATA.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExperimentStatistics(
    StatisticStatus status,
    int totalRuns,
    int completedRuns,
    int failedRuns,
    Double avgReturn,
    Double avgDrawdown,
    Double avgSharpe,
    Double bestReturn,
    Double worstReturn,
    Double bestSharpe
) {
    public double successRate() {
        return totalRuns == 0 ? 0.0 : (double) completedRuns / totalRuns;
    }
}
