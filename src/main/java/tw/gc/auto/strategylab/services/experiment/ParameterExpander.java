package tw.gc.auto.strategylab.services.experiment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.strategylab.enums.ExpansionMode;

/**
 * Turns an experiment's parameter ranges into concrete assignments and tasks.
 *
 * <p>Combinations are addressed by their position in the Cartesian product (first parameter
 * varying slowest), so neither down-sampling nor random sampling has to materialize the full
 * product.
 *
 * <ul>
 *   <li>GRID: the full product; above {@code max_combinations} every
 *       {@code (total / max)}-th combination is kept, up to {@code max}</li>
 *   <li>RANDOM: {@code sample_size} (or {@code max_combinations}) distinct combinations drawn
 *       without replacement</li>
 *   <li>LIST: the literal {@code combinations} of the document, unchanged</li>
 * </ul>
 */
@Component
@Slf4j
public class ParameterExpander {

    /**
     * Expands assignments with an unseeded draw for random mode.
     */
    public List<Map<String, Object>> expandCombinations(ExperimentConfiguration config) {
        return expandCombinations(config, new Random());
    }

    /**
     * Expands assignments; {@code random} is only consulted in random mode.
     */
    public List<Map<String, Object>> expandCombinations(ExperimentConfiguration config, Random random) {
        if (config.getExpansionMode() == ExpansionMode.LIST) {
            return config.getCombinations();
        }

        ParameterSpace space = ParameterSpace.of(config);
        long total = space.size();

        List<Map<String, Object>> combinations;
        if (config.getExpansionMode() == ExpansionMode.RANDOM) {
            Integer cap = config.getSampleSize() != null ? config.getSampleSize() : config.getMaxCombinations();
            long draw = cap == null ? total : Math.min(cap, total);
            combinations = decodeAll(space, sampleIndices(total, draw, random));
        } else if (config.getMaxCombinations() != null && total > config.getMaxCombinations()) {
            int max = config.getMaxCombinations();
            long stride = total / max;
            List<Long> indices = new ArrayList<>(max);
            for (long i = 0; i < max; i++) {
                indices.add(i * stride);
            }
            combinations = decodeAll(space, indices);
            log.debug("Grid of {} combinations down-sampled to {} (stride {})", total, max, stride);
        } else {
            combinations = decodeAll(space, rangeIndices(total));
        }
        return Collections.unmodifiableList(combinations);
    }

    public List<Task> expandTasks(ExperimentConfiguration config) {
        return expandTasks(config, new Random());
    }

    /**
     * Symbols × retained assignments, grouped by symbol in declaration order.
     */
    public List<Task> expandTasks(ExperimentConfiguration config, Random random) {
        return tasksFor(config.getSymbols(), expandCombinations(config, random));
    }

    public static List<Task> tasksFor(List<String> symbols, List<Map<String, Object>> combinations) {
        List<Task> tasks = new ArrayList<>(symbols.size() * combinations.size());
        for (String symbol : symbols) {
            for (Map<String, Object> combination : combinations) {
                tasks.add(new Task(symbol, combination));
            }
        }
        return tasks;
    }

    private static List<Map<String, Object>> decodeAll(ParameterSpace space, List<Long> indices) {
        List<Map<String, Object>> result = new ArrayList<>(indices.size());
        for (long index : indices) {
            result.add(space.decode(index));
        }
        return result;
    }

    private static List<Long> rangeIndices(long total) {
        if (total > Integer.MAX_VALUE) {
            throw new InvalidConfigurationException(
                "Parameter space of %d combinations is too large to enumerate; set max_combinations".formatted(total));
        }
        List<Long> indices = new ArrayList<>((int) total);
        for (long i = 0; i < total; i++) {
            indices.add(i);
        }
        return indices;
    }

    private static List<Long> sampleIndices(long total, long draw, Random random) {
        if (draw * 2 >= total) {
            List<Long> all = rangeIndices(total);
            Collections.shuffle(all, random);
            return new ArrayList<>(all.subList(0, (int) draw));
        }
        Set<Long> picked = new LinkedHashSet<>();
        while (picked.size() < draw) {
            picked.add(random.nextLong(total));
        }
        return new ArrayList<>(picked);
    }

    /**
     * Expanded value lists of every parameter, indexable as a mixed-radix number.
     */
    public static final class ParameterSpace {
        private final List<String> names;
        private final List<List<Object>> values;
        private final long size;

        private ParameterSpace(List<String> names, List<List<Object>> values, long size) {
            this.names = names;
            this.values = values;
            this.size = size;
        }

        public static ParameterSpace of(ExperimentConfiguration config) {
            List<String> names = new ArrayList<>();
            List<List<Object>> values = new ArrayList<>();
            long size = 1;
            for (var entry : config.getParameters().entrySet()) {
                List<Object> expanded = entry.getValue().expand();
                names.add(entry.getKey());
                values.add(expanded);
                try {
                    size = Math.multiplyExact(size, expanded.size());
                } catch (ArithmeticException e) {
                    throw new InvalidConfigurationException("Parameter space overflows: too many combinations", e);
                }
            }
            return new ParameterSpace(names, values, size);
        }

        public long size() {
            return size;
        }

        public List<String> names() {
            return names;
        }

        public List<List<Object>> values() {
            return values;
        }

        public Map<String, Object> decode(long index) {
            Object[] picked = new Object[names.size()];
            long remainder = index;
            for (int i = names.size() - 1; i >= 0; i--) {
                int radix = values.get(i).size();
                picked[i] = values.get(i).get((int) (remainder % radix));
                remainder /= radix;
            }
            Map<String, Object> assignment = new LinkedHashMap<>();
            for (int i = 0; i < names.size(); i++) {
                assignment.put(names.get(i), picked[i]);
            }
            return Collections.unmodifiableMap(assignment);
        }
    }
}
