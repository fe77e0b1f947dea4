package tw.gc.auto.strategylab.services.walkforward;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import tw.gc.auto.strategylab.services.walkforward.OverfittingDetector.OverfittingAnalysis;

/**
 * Structured walk-forward report, ready for persisting or rendering elsewhere.
 *
 * @param recommendedParameters Parameters of the best validated window, {@code null} without one
 * @param recommended Whether the robustness score reaches the threshold
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WalkForwardReport(
    String experimentId,
    String strategy,
    List<String> symbols,
    String timeframe,
    LocalDate start,
    LocalDate end,
    WalkForwardConfig walkForwardConfig,
    List<WalkForwardWindow> windows,
    int optimizedWindows,
    int validatedWindows,
    OosStatistics oosStatistics,
    Map<String, ParameterStability> parameterStability,
    Map<String, Object> recommendedParameters,
    RobustnessScore robustness,
    double recommendationThreshold,
    boolean recommended,
    OverfittingAnalysis overfitting,
    double trainSeconds,
    double testSeconds
) {

    public static WalkForwardReport of(WalkForwardResult result, OverfittingAnalysis overfitting) {
        WalkForwardConfig config = result.getWalkForwardConfig();
        RobustnessScore robustness = result.robustnessScore();
        return new WalkForwardReport(
            result.getConfiguration().getExperimentId(),
            result.getConfiguration().getStrategy(),
            result.getConfiguration().getSymbols(),
            result.getConfiguration().getTimeframe(),
            result.getStart(),
            result.getEnd(),
            config,
            result.getWindows(),
            result.optimizedWindows().size(),
            result.validatedWindows().size(),
            result.oosStatistics(),
            result.parameterStability(),
            result.robustParameters().orElse(null),
            robustness,
            config.recommendationThreshold(),
            robustness.meets(config.recommendationThreshold()),
            overfitting,
            result.getTrainDuration().toMillis() / 1000.0,
            result.getTestDuration().toMillis() / 1000.0
        );
    }
}
