package tw.gc.auto.strategylab.services.walkforward;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.extern.slf4j.Slf4j;

/**
 * Looks for signs of curve fitting in a walk-forward result.
 *
 * <p>Indicators:
 * <ul>
 *   <li>In-sample metric much larger than out-of-sample (ratio above 2 is concerning)</li>
 *   <li>Windows with a favourable IS metric but an adverse OOS metric</li>
 *   <li>Winning parameters drifting across windows</li>
 *   <li>Too few validated windows to tell</li>
 * </ul>
 */
@Component
@Slf4j
public class OverfittingDetector {

    /** IS/OOS ratio above which overfitting is suspected */
    public static final double ISOOS_RATIO_WARNING_THRESHOLD = 2.0;

    /** IS/OOS ratio above which overfitting is highly likely */
    public static final double ISOOS_RATIO_CRITICAL_THRESHOLD = 3.0;

    /** Parameter coefficient of variation above which a parameter is drifting */
    public static final double MAX_PARAMETER_CV = 0.5;

    /** Validated windows needed for a reliable verdict */
    public static final int MIN_WINDOWS_FOR_ANALYSIS = 3;

    public OverfittingAnalysis analyze(WalkForwardResult result) {
        List<WalkForwardWindow> validated = result.validatedWindows();
        if (validated.isEmpty()) {
            return new OverfittingAnalysis(false, 0.0,
                List.of("No validated windows, overfitting cannot be assessed"), Map.of());
        }

        WalkForwardConfig config = result.getWalkForwardConfig();
        String metric = config.metric();
        List<String> warnings = new ArrayList<>();
        Map<String, Object> diagnostics = new LinkedHashMap<>();

        double avgRatio = analyzeIsOosRatio(validated, metric, config, warnings, diagnostics);
        double adverseShare = analyzeOosPerformance(validated, metric, config, warnings, diagnostics);
        double stability = analyzeParameterStability(result, warnings, diagnostics);

        double confidence = 0.0;
        if (Double.isFinite(avgRatio)) {
            if (avgRatio > ISOOS_RATIO_CRITICAL_THRESHOLD) {
                confidence += 0.4;
            } else if (avgRatio > ISOOS_RATIO_WARNING_THRESHOLD) {
                confidence += 0.4 * (avgRatio - ISOOS_RATIO_WARNING_THRESHOLD)
                    / (ISOOS_RATIO_CRITICAL_THRESHOLD - ISOOS_RATIO_WARNING_THRESHOLD);
            }
        }
        confidence += 0.35 * adverseShare;
        confidence += 0.25 * (1.0 - stability);
        confidence = Math.min(1.0, confidence);

        if (validated.size() < MIN_WINDOWS_FOR_ANALYSIS) {
            warnings.add("Insufficient windows (%d) for reliable overfitting detection (min: %d)"
                .formatted(validated.size(), MIN_WINDOWS_FOR_ANALYSIS));
        }

        boolean overfit = confidence > 0.5;
        log.info("Overfitting analysis: confidence={}, overfit={}, warnings={}",
            "%.2f".formatted(confidence), overfit, warnings.size());
        return new OverfittingAnalysis(overfit, confidence, warnings, diagnostics);
    }

    /**
     * Mean of |IS| / |OOS| over windows where both metrics are favourable.
     */
    private double analyzeIsOosRatio(List<WalkForwardWindow> windows, String metric, WalkForwardConfig config,
                                     List<String> warnings, Map<String, Object> diagnostics) {
        List<Double> ratios = new ArrayList<>();
        for (WalkForwardWindow window : windows) {
            OptionalDouble is = window.trainMetric(metric);
            OptionalDouble oos = window.testMetric(metric);
            if (is.isPresent() && oos.isPresent()
                    && config.isFavourable(is.getAsDouble()) && config.isFavourable(oos.getAsDouble())) {
                ratios.add(Math.abs(is.getAsDouble()) / Math.abs(oos.getAsDouble()));
            }
        }
        if (ratios.isEmpty()) {
            return Double.NaN;
        }

        double avgRatio = ratios.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        int criticalCount = (int) ratios.stream().filter(r -> r > ISOOS_RATIO_CRITICAL_THRESHOLD).count();
        diagnostics.put("avg_is_oos_ratio", avgRatio);
        diagnostics.put("max_is_oos_ratio", ratios.stream().mapToDouble(Double::doubleValue).max().orElse(0));
        diagnostics.put("critical_ratio_windows", criticalCount);

        if (avgRatio > ISOOS_RATIO_CRITICAL_THRESHOLD) {
            warnings.add("Critical: Average IS/OOS ratio (%.2f) exceeds %.1f - severe overfitting likely"
                .formatted(avgRatio, ISOOS_RATIO_CRITICAL_THRESHOLD));
        } else if (avgRatio > ISOOS_RATIO_WARNING_THRESHOLD) {
            warnings.add("Warning: Average IS/OOS ratio (%.2f) exceeds %.1f - moderate overfitting suspected"
                .formatted(avgRatio, ISOOS_RATIO_WARNING_THRESHOLD));
        }
        if (criticalCount > windows.size() / 2) {
            warnings.add("Critical: %d/%d windows have IS/OOS ratio > %.1f"
                .formatted(criticalCount, windows.size(), ISOOS_RATIO_CRITICAL_THRESHOLD));
        }
        return avgRatio;
    }

    /**
     * @return share of windows with a favourable IS but adverse OOS metric
     */
    private double analyzeOosPerformance(List<WalkForwardWindow> windows, String metric, WalkForwardConfig config,
                                         List<String> warnings, Map<String, Object> diagnostics) {
        int adverse = 0;
        int flipped = 0;
        for (WalkForwardWindow window : windows) {
            OptionalDouble oos = window.testMetric(metric);
            if (oos.isEmpty() || config.isFavourable(oos.getAsDouble())) {
                continue;
            }
            adverse++;
            OptionalDouble is = window.trainMetric(metric);
            if (is.isPresent() && config.isFavourable(is.getAsDouble())) {
                flipped++;
            }
        }
        diagnostics.put("adverse_oos_windows", adverse);
        diagnostics.put("favourable_is_adverse_oos_windows", flipped);

        double adverseRatio = (double) adverse / windows.size();
        if (adverseRatio > 0.5) {
            warnings.add("Critical: %.0f%% of windows have an adverse OOS %s".formatted(adverseRatio * 100, metric));
        } else if (adverseRatio > 0.3) {
            warnings.add("Warning: %.0f%% of windows have an adverse OOS %s".formatted(adverseRatio * 100, metric));
        }
        if (flipped > windows.size() / 3) {
            warnings.add("Critical: %d/%d windows show favourable IS but adverse OOS - classic overfit pattern"
                .formatted(flipped, windows.size()));
        }
        return (double) flipped / windows.size();
    }

    /**
     * @return stability in [0, 1], 1 when nothing can be measured
     */
    private double analyzeParameterStability(WalkForwardResult result, List<String> warnings,
                                             Map<String, Object> diagnostics) {
        Map<String, ParameterStability> stabilities = result.parameterStability();
        Map<String, Double> cvs = new LinkedHashMap<>();
        List<Double> finite = new ArrayList<>();
        stabilities.forEach((name, stability) -> {
            double cv = stability.coefficientOfVariation();
            if (stability.isDrifting(MAX_PARAMETER_CV)) {
                warnings.add("Warning: Parameter '%s' has high drift (CV=%.2f > %.2f)"
                    .formatted(name, cv, MAX_PARAMETER_CV));
            }
            if (Double.isFinite(cv)) {
                cvs.put(name, cv);
                finite.add(cv);
            }
        });
        diagnostics.put("parameter_coefficients_of_variation", cvs);
        if (finite.isEmpty()) {
            return 1.0;
        }
        double avgCv = finite.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double score = Math.max(0, 1.0 - avgCv / MAX_PARAMETER_CV);
        diagnostics.put("parameter_stability_score", score);
        return score;
    }

    /**
     * Result of overfitting analysis.
     *
     * @param overfit Whether overfitting is detected
     * @param confidenceLevel Confidence of the verdict in [0, 1]
     * @param warnings Warning messages
     * @param diagnostics Figures behind the warnings
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record OverfittingAnalysis(
        boolean overfit,
        double confidenceLevel,
        List<String> warnings,
        Map<String, Object> diagnostics
    ) {
        public OverfittingAnalysis {
            warnings = List.copyOf(warnings);
            diagnostics = Map.copyOf(diagnostics);
        }
    }
}
