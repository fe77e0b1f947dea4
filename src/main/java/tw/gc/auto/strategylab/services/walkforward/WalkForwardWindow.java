package tw.gc.auto.strategylab.services.walkforward;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.Getter;
import tw.gc.auto.strategylab.enums.WindowState;

/**
 * One train/test pair of a walk-forward run.
 *
 * <p>The training (in-sample) period chooses the parameters, the test (out-of-sample) period
 * measures them unchanged. Both periods are half-open: the test period starts on the day the
 * training period ends.
 *
 * <p>Created {@link WindowState#PENDING}, moved to {@link WindowState#OPTIMIZED} once a winner
 * was chosen on the training period and to {@link WindowState#VALIDATED} once the winner was run
 * on the test period. A window that cannot advance keeps its state and records why.
 */
@Getter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WalkForwardWindow {

    private final int index;
    private final LocalDate trainStart;
    private final LocalDate trainEnd;
    private final LocalDate testStart;
    private final LocalDate testEnd;

    private WindowState state = WindowState.PENDING;
    private Map<String, Object> bestParameters;
    private Map<String, Double> trainMetrics = Map.of();
    private Map<String, Double> testMetrics = Map.of();
    private int candidatesEvaluated;
    private int testRuns;
    private String failureReason;

    public WalkForwardWindow(int index, LocalDate trainStart, LocalDate trainEnd,
                             LocalDate testStart, LocalDate testEnd) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative, got: %d".formatted(index));
        }
        if (trainStart == null || trainEnd == null || testStart == null || testEnd == null) {
            throw new IllegalArgumentException("All dates must be non-null");
        }
        if (!trainStart.isBefore(trainEnd)) {
            throw new IllegalArgumentException("trainStart (%s) must be before trainEnd (%s)"
                .formatted(trainStart, trainEnd));
        }
        if (!testStart.isBefore(testEnd)) {
            throw new IllegalArgumentException("testStart (%s) must be before testEnd (%s)"
                .formatted(testStart, testEnd));
        }
        if (trainEnd.isAfter(testStart)) {
            throw new IllegalArgumentException("trainEnd (%s) must not be after testStart (%s)"
                .formatted(trainEnd, testStart));
        }
        this.index = index;
        this.trainStart = trainStart;
        this.trainEnd = trainEnd;
        this.testStart = testStart;
        this.testEnd = testEnd;
    }

    /**
     * Records the training winner.
     *
     * @throws IllegalStateException unless the window is pending
     */
    public void markOptimized(Map<String, Object> parameters, Map<String, Double> metrics, int candidates) {
        if (state != WindowState.PENDING) {
            throw new IllegalStateException("Window %d is %s, cannot be optimized again".formatted(index, state));
        }
        this.bestParameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.trainMetrics = Map.copyOf(metrics);
        this.candidatesEvaluated = candidates;
        this.failureReason = null;
        this.state = WindowState.OPTIMIZED;
    }

    /**
     * Records the out-of-sample measurement of the frozen winner.
     *
     * @throws IllegalStateException unless the window is optimized
     */
    public void markValidated(Map<String, Double> metrics, int runs) {
        if (state != WindowState.OPTIMIZED) {
            throw new IllegalStateException("Window %d is %s, only an optimized window can be validated"
                .formatted(index, state));
        }
        this.testMetrics = Map.copyOf(metrics);
        this.testRuns = runs;
        this.failureReason = null;
        this.state = WindowState.VALIDATED;
    }

    /**
     * Records why the window could not advance. The state is left unchanged.
     */
    public void recordFailure(String reason) {
        this.failureReason = reason;
    }

    @JsonIgnore
    public boolean isOptimized() {
        return state != WindowState.PENDING;
    }

    @JsonIgnore
    public boolean isValidated() {
        return state == WindowState.VALIDATED;
    }

    public OptionalDouble trainMetric(String metric) {
        return value(trainMetrics, metric);
    }

    public OptionalDouble testMetric(String metric) {
        return value(testMetrics, metric);
    }

    @JsonIgnore
    public long getTrainDays() {
        return ChronoUnit.DAYS.between(trainStart, trainEnd);
    }

    @JsonIgnore
    public long getTestDays() {
        return ChronoUnit.DAYS.between(testStart, testEnd);
    }

    public String describe() {
        return "Window %d: Train [%s → %s) (%d days) | Test [%s → %s) (%d days) | %s"
            .formatted(index, trainStart, trainEnd, getTrainDays(), testStart, testEnd, getTestDays(), state);
    }

    private static OptionalDouble value(Map<String, Double> metrics, String metric) {
        Double value = metrics.get(metric);
        return value != null && Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    @Override
    public String toString() {
        return describe();
    }
}
