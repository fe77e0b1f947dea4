package tw.gc.auto.strategylab.services.walkforward;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import tw.gc.auto.strategylab.services.runner.BacktestMetrics;
import tw.gc.auto.strategylab.services.runner.RunRecord;

/**
 * Performance of one parameter assignment across every symbol it was run on.
 *
 * <p>Each metric is the mean of its finite values over the completed runs, except
 * {@code num_trades}, which is summed.
 *
 * @param parameters The assignment
 * @param completedRuns Runs of the assignment that completed
 * @param failedRuns Runs of the assignment that failed
 * @param metrics Aggregated metrics, empty when no run completed
 */
public record AssignmentPerformance(
    Map<String, Object> parameters,
    int completedRuns,
    int failedRuns,
    Map<String, Double> metrics
) {

    public OptionalDouble metric(String name) {
        Double value = metrics.get(name);
        return value != null && Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    public int totalTrades() {
        Double trades = metrics.get(BacktestMetrics.NUM_TRADES);
        return trades == null ? 0 : trades.intValue();
    }

    /**
     * Groups runs by assignment, in order of first appearance.
     */
    public static List<AssignmentPerformance> aggregate(Collection<RunRecord> runs) {
        Map<Map<String, Object>, List<RunRecord>> byAssignment = new LinkedHashMap<>();
        for (RunRecord run : runs) {
            byAssignment.computeIfAbsent(run.getParameters(), k -> new ArrayList<>()).add(run);
        }
        List<AssignmentPerformance> performances = new ArrayList<>(byAssignment.size());
        byAssignment.forEach((parameters, group) -> performances.add(of(parameters, group)));
        return performances;
    }

    static AssignmentPerformance of(Map<String, Object> parameters, List<RunRecord> runs) {
        Map<String, double[]> sums = new LinkedHashMap<>();
        int completed = 0;
        int failed = 0;
        for (RunRecord run : runs) {
            if (!run.isCompleted()) {
                failed += run.isFailed() ? 1 : 0;
                continue;
            }
            completed++;
            run.getMetrics().asMap().forEach((name, value) -> {
                if (value != null && Double.isFinite(value)) {
                    double[] sum = sums.computeIfAbsent(name, k -> new double[2]);
                    sum[0] += value;
                    sum[1]++;
                }
            });
        }
        Map<String, Double> metrics = new LinkedHashMap<>();
        sums.forEach((name, sum) -> metrics.put(name,
            BacktestMetrics.NUM_TRADES.equals(name) ? sum[0] : sum[0] / sum[1]));
        return new AssignmentPerformance(parameters, completed, failed, metrics);
    }
}
