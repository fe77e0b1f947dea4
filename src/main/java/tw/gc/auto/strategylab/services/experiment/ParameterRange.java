package tw.gc.auto.strategylab.services.experiment;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admissible values of a single strategy parameter.
 *
 * <p>Three representations are supported:
 * <pre>
 * explicit list      [5, 10, 20]                          → 5, 10, 20
 * linear interval    {start: 10, stop: 50, step: 10}      → 10, 20, 30, 40, 50
 *                    {start: 0, stop: 1, count: 5}        → 0.0, 0.25, 0.5, 0.75, 1.0
 * log interval       {start: 0.001, stop: 1, count: 4, log: true}
 * </pre>
 *
 * <p>{@link #expand()} always returns a non-empty, order-preserving list. Step
 * intervals yield ⌈(stop−start)/step⌉+1 values, the last one clamped to {@code stop}.
 *
 * @param name Parameter name, unique within a configuration
 * @param values Explicit values, or {@code null} for an interval
 * @param start Interval start (inclusive)
 * @param stop Interval stop (inclusive)
 * @param step Linear step size, mutually exclusive with {@code count}
 * @param count Number of evenly spaced values
 * @param logScale Whether {@code count} values are spaced logarithmically
 */
public record ParameterRange(
    String name,
    List<Object> values,
    Double start,
    Double stop,
    Double step,
    Integer count,
    boolean logScale
) {
    /** Number of log-spaced values used when a log interval omits {@code count} */
    public static final int DEFAULT_LOG_COUNT = 10;

    /** Upper bound on the values a single range may expand to */
    public static final long MAX_VALUES = 1_000_000;

    private static final int DIVISION_SCALE = 12;

    public ParameterRange {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("Parameter name cannot be null or blank");
        }
        if (values != null) {
            if (start != null || stop != null || step != null || count != null || logScale) {
                throw new InvalidConfigurationException(
                    "Parameter '%s' mixes an explicit value list with an interval".formatted(name));
            }
            if (values.isEmpty()) {
                throw new InvalidConfigurationException("Parameter '%s' has an empty value list".formatted(name));
            }
            for (Object value : values) {
                if (!ParameterValues.isSupported(value)) {
                    throw new InvalidConfigurationException("Parameter '%s' has unsupported value: %s"
                        .formatted(name, value));
                }
            }
            values = Collections.unmodifiableList(new ArrayList<>(values));
        } else {
            validateInterval(name, start, stop, step, count, logScale);
            if (logScale && count == null) {
                count = DEFAULT_LOG_COUNT;
            }
        }
    }

    private static void validateInterval(String name, Double start, Double stop, Double step,
                                         Integer count, boolean logScale) {
        if (start == null || stop == null) {
            throw new InvalidConfigurationException(
                "Parameter '%s' needs either a value list or both start and stop".formatted(name));
        }
        if (!Double.isFinite(start) || !Double.isFinite(stop)) {
            throw new InvalidConfigurationException("Parameter '%s' bounds must be finite".formatted(name));
        }
        if (count != null && count < 1) {
            throw new InvalidConfigurationException("Parameter '%s' count must be >= 1, got: %d"
                .formatted(name, count));
        }
        if (count != null && count > MAX_VALUES) {
            throw new InvalidConfigurationException("Parameter '%s' expands to more than %d values"
                .formatted(name, MAX_VALUES));
        }
        if (logScale) {
            if (step != null) {
                throw new InvalidConfigurationException(
                    "Parameter '%s' is log-scaled and takes count, not step".formatted(name));
            }
            if (start <= 0 || stop <= 0) {
                throw new InvalidConfigurationException(
                    "Parameter '%s' is log-scaled and needs strictly positive bounds, got [%s, %s]"
                        .formatted(name, start, stop));
            }
            return;
        }
        if ((step == null) == (count == null)) {
            throw new InvalidConfigurationException(
                "Parameter '%s' needs exactly one of step or count".formatted(name));
        }
        if (step != null) {
            if (!Double.isFinite(step) || step <= 0) {
                throw new InvalidConfigurationException("Parameter '%s' step must be positive, got: %s"
                    .formatted(name, step));
            }
            if (start > stop) {
                throw new InvalidConfigurationException(
                    "Parameter '%s' start (%s) cannot be greater than stop (%s)".formatted(name, start, stop));
            }
            if (stepCount(start, stop, step) > MAX_VALUES) {
                throw new InvalidConfigurationException("Parameter '%s' expands to more than %d values"
                    .formatted(name, MAX_VALUES));
            }
        }
    }

    /**
     * Creates a range from an explicit list of values.
     */
    public static ParameterRange ofValues(String name, List<?> values) {
        return new ParameterRange(name, values == null ? null : new ArrayList<>(values), null, null, null, null, false);
    }

    /**
     * Creates a linear range {@code start, start+step, ..., stop}.
     */
    public static ParameterRange linear(String name, double start, double stop, double step) {
        return new ParameterRange(name, null, start, stop, step, null, false);
    }

    /**
     * Creates {@code count} evenly spaced values from {@code start} to {@code stop}.
     */
    public static ParameterRange linearCount(String name, double start, double stop, int count) {
        return new ParameterRange(name, null, start, stop, null, count, false);
    }

    /**
     * Creates {@code count} logarithmically spaced values from {@code start} to {@code stop}.
     */
    public static ParameterRange logScale(String name, double start, double stop, int count) {
        return new ParameterRange(name, null, start, stop, null, count, true);
    }

    public boolean isExplicit() {
        return values != null;
    }

    /**
     * Expands the range into its concrete values.
     *
     * @return Non-empty, order-preserving list of values
     */
    public List<Object> expand() {
        if (values != null) {
            return values;
        }
        if (logScale) {
            return logValues();
        }
        if (step != null) {
            return stepValues();
        }
        return countValues();
    }

    /**
     * Number of values {@link #expand()} returns.
     */
    public int size() {
        if (values != null) {
            return values.size();
        }
        if (step != null) {
            return (int) stepCount(start, stop, step);
        }
        return count;
    }

    /**
     * Whether every expanded value is numeric.
     */
    public boolean isNumeric() {
        return values == null || values.stream().allMatch(v -> v instanceof Number);
    }

    private List<Object> stepValues() {
        int n = (int) stepCount(start, stop, step);
        boolean integral = ParameterValues.isIntegral(start) && ParameterValues.isIntegral(step)
            && ParameterValues.isIntegral(stop);
        BigDecimal origin = BigDecimal.valueOf(start);
        BigDecimal increment = BigDecimal.valueOf(step);
        List<Object> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double value = Math.min(origin.add(increment.multiply(BigDecimal.valueOf(i))).doubleValue(), stop);
            result.add(integral ? ParameterValues.narrow(value) : value);
        }
        return Collections.unmodifiableList(result);
    }

    private List<Object> countValues() {
        List<Object> result = new ArrayList<>(count);
        if (count == 1) {
            result.add(start);
            return Collections.unmodifiableList(result);
        }
        for (int i = 0; i < count; i++) {
            double value = i == count - 1 ? stop : start + (stop - start) * i / (count - 1);
            result.add(value);
        }
        return Collections.unmodifiableList(result);
    }

    private List<Object> logValues() {
        List<Object> result = new ArrayList<>(count);
        if (count == 1) {
            result.add(start);
            return Collections.unmodifiableList(result);
        }
        double logStart = Math.log10(start);
        double logStop = Math.log10(stop);
        for (int i = 0; i < count; i++) {
            double value;
            if (i == 0) {
                value = start;
            } else if (i == count - 1) {
                value = stop;
            } else {
                value = Math.pow(10, logStart + (logStop - logStart) * i / (count - 1));
            }
            result.add(value);
        }
        return Collections.unmodifiableList(result);
    }

    private static long stepCount(double start, double stop, double step) {
        BigDecimal span = BigDecimal.valueOf(stop).subtract(BigDecimal.valueOf(start));
        BigDecimal steps = span.divide(BigDecimal.valueOf(step), DIVISION_SCALE, RoundingMode.HALF_EVEN)
            .setScale(0, RoundingMode.CEILING);
        return steps.longValue() + 1;
    }

    /**
     * Document form: the literal list, or a {start, stop, step|count, log} map.
     */
    public Object toDocumentValue() {
        if (values != null) {
            return values;
        }
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("start", start);
        spec.put("stop", stop);
        if (step != null) {
            spec.put("step", step);
        }
        if (count != null) {
            spec.put("count", count);
        }
        if (logScale) {
            spec.put("log", true);
        }
        return spec;
    }
}
