package tw.gc.auto.strategylab.services.walkforward;

import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Spread of one numeric parameter's winning value across optimized windows.
 *
 * @param values Winning values in window order
 * @param mean Mean of the values
 * @param std Population standard deviation
 * @param coefficientOfVariation {@code std / |mean|}; infinite when the mean is zero and the
 *                               values differ, zero when they are all equal
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ParameterStability(
    List<Double> values,
    double mean,
    double std,
    double coefficientOfVariation
) {

    public static ParameterStability of(List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("No values");
        }
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum() / values.size();
        double std = Math.sqrt(variance);
        double cv;
        if (std == 0) {
            cv = 0;
        } else if (mean == 0) {
            cv = Double.POSITIVE_INFINITY;
        } else {
            cv = std / Math.abs(mean);
        }
        return new ParameterStability(List.copyOf(values), mean, std, cv);
    }

    public boolean isDrifting(double maxCv) {
        return coefficientOfVariation > maxCv;
    }
}
