package tw.gc.auto.strategylab.services.walkforward;

import java.util.Collection;
import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import tw.gc.auto.strategylab.enums.StatisticStatus;

/**
 * Composite 0-100 score of walk-forward robustness.
 *
 * <ul>
 *   <li>consistency, up to 40: share of validated windows whose OOS metric is on the favourable
 *       side of zero; needs two validated windows</li>
 *   <li>decay, up to 30: relative drop from the IS mean to the OOS mean, no credit once the
 *       drop reaches 100%; needs both means and a non-zero IS mean</li>
 *   <li>stability, up to 30: mean CV of the numeric winning parameters, no credit from
 *       {@value #MAX_STABLE_CV}; needs at least one parameter with a finite CV</li>
 * </ul>
 *
 * A component without enough data is {@code null} and adds nothing. Without any component the
 * status is {@link StatisticStatus#INSUFFICIENT_DATA} and the total is zero.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RobustnessScore(
    StatisticStatus status,
    Double consistency,
    Double decay,
    Double stability,
    double total
) {
    public static final double CONSISTENCY_WEIGHT = 40.0;
    public static final double DECAY_WEIGHT = 30.0;
    public static final double STABILITY_WEIGHT = 30.0;
    public static final double MAX_STABLE_CV = 0.5;

    /**
     * @param isValues In-sample metric of every optimized window
     * @param oosValues Out-of-sample metric of every validated window
     * @param stabilities Stability of each numeric parameter
     */
    public static RobustnessScore compute(List<Double> isValues, List<Double> oosValues,
                                          Collection<ParameterStability> stabilities, boolean maximize) {
        Double consistency = null;
        if (oosValues.size() >= 2) {
            long favourable = oosValues.stream().filter(v -> maximize ? v > 0 : v < 0).count();
            consistency = CONSISTENCY_WEIGHT * favourable / oosValues.size();
        }

        Double decay = null;
        if (!isValues.isEmpty() && !oosValues.isEmpty()) {
            double isMean = mean(isValues);
            double oosMean = mean(oosValues);
            if (isMean != 0) {
                double drop = (maximize ? isMean - oosMean : oosMean - isMean) / Math.abs(isMean);
                decay = DECAY_WEIGHT * (1 - clamp(drop, 0, 1));
            }
        }

        Double stability = null;
        List<Double> cvs = stabilities.stream()
            .map(ParameterStability::coefficientOfVariation)
            .filter(Double::isFinite)
            .toList();
        if (!cvs.isEmpty()) {
            stability = STABILITY_WEIGHT * (1 - Math.min(mean(cvs) / MAX_STABLE_CV, 1));
        }

        if (consistency == null && decay == null && stability == null) {
            return new RobustnessScore(StatisticStatus.INSUFFICIENT_DATA, null, null, null, 0);
        }
        double total = (consistency == null ? 0 : consistency)
            + (decay == null ? 0 : decay)
            + (stability == null ? 0 : stability);
        return new RobustnessScore(StatisticStatus.SUCCESS, consistency, decay, stability, clamp(total, 0, 100));
    }

    public boolean meets(double threshold) {
        return status.isSuccess() && total >= threshold;
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
