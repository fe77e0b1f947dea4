package tw.gc.auto.strategylab.services.experiment;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Helpers for the loosely typed values that make up a parameter assignment
 * (integers, decimals, strings, booleans).
 */
public final class ParameterValues {

    private static final String NUMBER_TAG = "n:";
    private static final String STRING_TAG = "s:";

    private ParameterValues() {
    }

    /**
     * Returns {@code true} for finite values without a fractional part.
     */
    public static boolean isIntegral(double value) {
        return Double.isFinite(value) && value == Math.rint(value);
    }

    /**
     * Narrows a double to Integer or Long when it is integral, keeping Double otherwise.
     */
    public static Number narrow(double value) {
        if (!isIntegral(value)) {
            return value;
        }
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return (int) value;
        }
        return (long) value;
    }

    /**
     * Numeric view of a parameter value; empty for strings, booleans and nulls.
     */
    public static OptionalDouble asDouble(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
        }
        return OptionalDouble.empty();
    }

    /**
     * Canonical, order- and representation-independent form of a value, used for
     * identifier hashing and grouping. Numbers and strings carry a type tag: 10, 10L and 10.0
     * all normalize to {@code "n:10"}, while the string {@code "10"} becomes {@code "s:10"}.
     */
    public static Object canonical(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            String text = Double.isFinite(d)
                ? new BigDecimal(number.toString()).stripTrailingZeros().toPlainString()
                : String.valueOf(d);
            return NUMBER_TAG + text;
        }
        if (value instanceof String text) {
            return STRING_TAG + text;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), canonical(v)));
            return sorted;
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> list = new ArrayList<>();
            iterable.forEach(v -> list.add(canonical(v)));
            return list;
        }
        return value;
    }

    /**
     * Checks whether a value can appear in a parameter assignment.
     */
    public static boolean isSupported(Object value) {
        return value instanceof Number || value instanceof String || value instanceof Boolean;
    }
}
