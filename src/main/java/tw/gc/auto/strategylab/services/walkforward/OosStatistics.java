package tw.gc.auto.strategylab.services.walkforward;

import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import tw.gc.auto.strategylab.enums.StatisticStatus;

/**
 * Aggregate of the out-of-sample metric over validated windows.
 *
 * <p>{@code std} needs two windows and is {@code null} otherwise; everything else needs one.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OosStatistics(
    StatisticStatus status,
    String metric,
    int count,
    Double mean,
    Double std,
    Double max,
    Double min,
    int favourableCount
) {

    public static OosStatistics of(String metric, List<Double> values, WalkForwardConfig config) {
        if (values.isEmpty()) {
            return new OosStatistics(StatisticStatus.INSUFFICIENT_DATA, metric, 0, null, null, null, null, 0);
        }
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        Double std = null;
        if (values.size() > 1) {
            double sumSq = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum();
            std = Math.sqrt(sumSq / (values.size() - 1));
        }
        int favourable = (int) values.stream().filter(config::isFavourable).count();
        return new OosStatistics(StatisticStatus.SUCCESS, metric, values.size(), mean, std,
            values.stream().mapToDouble(Double::doubleValue).max().orElse(0),
            values.stream().mapToDouble(Double::doubleValue).min().orElse(0),
            favourable);
    }
}
