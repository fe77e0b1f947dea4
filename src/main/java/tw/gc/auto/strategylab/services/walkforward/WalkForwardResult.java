package tw.gc.auto.strategylab.services.walkforward;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import lombok.Getter;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;
import tw.gc.auto.strategylab.services.experiment.ParameterValues;

/**
 * Outcome of a walk-forward run: the windows in order plus read-only views derived from them.
 *
 * <p>Only optimized windows contribute in-sample values and parameter stability, only validated
 * windows contribute out-of-sample values.
 */
@Getter
public final class WalkForwardResult {

    private final ExperimentConfiguration configuration;
    private final WalkForwardConfig walkForwardConfig;
    private final LocalDate start;
    private final LocalDate end;
    private final List<WalkForwardWindow> windows;
    private final Duration trainDuration;
    private final Duration testDuration;

    public WalkForwardResult(ExperimentConfiguration configuration, WalkForwardConfig walkForwardConfig,
                             LocalDate start, LocalDate end, List<WalkForwardWindow> windows,
                             Duration trainDuration, Duration testDuration) {
        this.configuration = configuration;
        this.walkForwardConfig = walkForwardConfig;
        this.start = start;
        this.end = end;
        this.windows = List.copyOf(windows);
        this.trainDuration = trainDuration;
        this.testDuration = testDuration;
    }

    public String getMetric() {
        return walkForwardConfig.metric();
    }

    public List<WalkForwardWindow> optimizedWindows() {
        return windows.stream().filter(WalkForwardWindow::isOptimized).toList();
    }

    public List<WalkForwardWindow> validatedWindows() {
        return windows.stream().filter(WalkForwardWindow::isValidated).toList();
    }

    /**
     * Test metrics of every validated window, keyed by window index.
     */
    public Map<Integer, Map<String, Double>> oosMetrics() {
        Map<Integer, Map<String, Double>> table = new LinkedHashMap<>();
        validatedWindows().forEach(w -> table.put(w.getIndex(), w.getTestMetrics()));
        return table;
    }

    /**
     * Train metrics of every optimized window, keyed by window index.
     */
    public Map<Integer, Map<String, Double>> isMetrics() {
        Map<Integer, Map<String, Double>> table = new LinkedHashMap<>();
        optimizedWindows().forEach(w -> table.put(w.getIndex(), w.getTrainMetrics()));
        return table;
    }

    public List<Double> isValues() {
        return values(optimizedWindows(), true);
    }

    public List<Double> oosValues() {
        return values(validatedWindows(), false);
    }

    /**
     * Stability of every parameter whose winning value is numeric in at least two optimized
     * windows.
     */
    public Map<String, ParameterStability> parameterStability() {
        Map<String, List<Double>> byParameter = new LinkedHashMap<>();
        for (WalkForwardWindow window : optimizedWindows()) {
            window.getBestParameters().forEach((name, value) -> {
                OptionalDouble numeric = ParameterValues.asDouble(value);
                if (numeric.isPresent()) {
                    byParameter.computeIfAbsent(name, k -> new ArrayList<>()).add(numeric.getAsDouble());
                }
            });
        }
        Map<String, ParameterStability> table = new LinkedHashMap<>();
        byParameter.forEach((name, values) -> {
            if (values.size() > 1) {
                table.put(name, ParameterStability.of(values));
            }
        });
        return table;
    }

    /**
     * Parameters of the validated window with the best out-of-sample metric.
     */
    public Optional<Map<String, Object>> robustParameters() {
        String metric = getMetric();
        Comparator<WalkForwardWindow> byOos = Comparator.comparingDouble(w -> w.testMetric(metric).getAsDouble());
        var candidates = validatedWindows().stream().filter(w -> w.testMetric(metric).isPresent());
        Optional<WalkForwardWindow> best = walkForwardConfig.maximize() ? candidates.max(byOos) : candidates.min(byOos);
        return best.map(WalkForwardWindow::getBestParameters);
    }

    public RobustnessScore robustnessScore() {
        return RobustnessScore.compute(isValues(), oosValues(), parameterStability().values(),
            walkForwardConfig.maximize());
    }

    public OosStatistics oosStatistics() {
        return OosStatistics.of(getMetric(), oosValues(), walkForwardConfig);
    }

    private List<Double> values(List<WalkForwardWindow> source, boolean train) {
        String metric = getMetric();
        List<Double> values = new ArrayList<>();
        for (WalkForwardWindow window : source) {
            OptionalDouble value = train ? window.trainMetric(metric) : window.testMetric(metric);
            value.ifPresent(values::add);
        }
        return values;
    }

    @Override
    public String toString() {
        return "WalkForwardResult[%s, windows=%d, optimized=%d, validated=%d]"
            .formatted(configuration.getExperimentId(), windows.size(), optimizedWindows().size(),
                validatedWindows().size());
    }
}
