package tw.gc.auto.strategylab.services.search;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.Set;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.strategylab.enums.ExpansionMode;
import tw.gc.auto.strategylab.enums.SearchMode;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;
import tw.gc.auto.strategylab.services.experiment.ParameterExpander;
import tw.gc.auto.strategylab.services.experiment.ParameterExpander.ParameterSpace;
import tw.gc.auto.strategylab.services.runner.BacktestFunction;
import tw.gc.auto.strategylab.services.runner.BatchRunner;
import tw.gc.auto.strategylab.services.runner.ExperimentResult;
import tw.gc.auto.strategylab.services.runner.RunnerOptions;

/**
 * Sequential model-based search over the expanded parameter space.
 *
 * <p>Each parameter's expanded values are encoded by their position, scaled to [0, 1]. One
 * evaluation runs an assignment on every symbol and scores it by the mean objective of its
 * completed runs. After {@code initialPoints} random evaluations a surrogate is fitted to the
 * observations and the unobserved candidate with the highest expected improvement is evaluated
 * next, until the call budget is spent or the space is exhausted.
 *
 * <p>An unavailable backend switches the whole search to {@link RandomSearchStrategy}. A model
 * that cannot be fitted in one step only turns that step into a random proposal.
 */
@Component
@Slf4j
public class ModelBasedSearchStrategy implements SearchStrategy {

    private final BatchRunner batchRunner;
    private final SurrogateBackend surrogateBackend;
    private final RandomSearchStrategy fallback;

    public ModelBasedSearchStrategy(BatchRunner batchRunner, SurrogateBackend surrogateBackend,
                                    RandomSearchStrategy fallback) {
        this.batchRunner = batchRunner;
        this.surrogateBackend = surrogateBackend;
        this.fallback = fallback;
    }

    @Override
    public SearchMode mode() {
        return SearchMode.MODEL_BASED;
    }

    @Override
    public ExperimentResult search(ExperimentConfiguration config, BacktestFunction backtest, SearchOptions options)
            throws IOException {
        if (surrogateBackend == null || !surrogateBackend.isAvailable()) {
            log.warn("⚠️ Surrogate backend {} unavailable, falling back to random search",
                surrogateBackend == null ? "none" : surrogateBackend.name());
            return fallback.search(config, backtest, options);
        }
        if (config.getExpansionMode() == ExpansionMode.LIST) {
            log.warn("⚠️ Model-based search needs parameter ranges, {} lists literal combinations; "
                + "falling back to random search", config.getExperimentId());
            return fallback.search(config, backtest, options);
        }

        ParameterSpace space = ParameterSpace.of(config);
        int budget = budget(config, options, space.size());
        Random random = options.random();
        // observations are read back from each evaluation's records
        RunnerOptions runnerOptions = options.applyTo(batchRunner.getDefaultOptions()).toBuilder()
            .retainRuns(true)
            .build();

        log.info("🧠 Model-based search for {}: {} evaluations over {} combinations ({} initial, backend {})",
            config.getExperimentId(), budget, space.size(), Math.min(options.initialPoints(), budget),
            surrogateBackend.name());

        List<ExperimentResult> evaluations = new ArrayList<>();
        Set<Long> tried = new HashSet<>();
        List<double[]> observedPoints = new ArrayList<>();
        List<Double> observedValues = new ArrayList<>();

        while (evaluations.size() < budget && tried.size() < space.size()) {
            long index;
            if (observedValues.size() < Math.max(2, options.initialPoints())) {
                index = randomUntried(space.size(), tried, random);
            } else {
                index = propose(space, tried, observedPoints, observedValues, options, random);
            }
            tried.add(index);

            Map<String, Object> assignment = space.decode(index);
            ExperimentResult result = batchRunner.run(config,
                ParameterExpander.tasksFor(config.getSymbols(), List.of(assignment)), backtest, runnerOptions);
            evaluations.add(result);

            OptionalDouble score = meanObjective(result, options.metric());
            if (score.isPresent()) {
                observedPoints.add(encode(space, index));
                observedValues.add(options.maximize() ? score.getAsDouble() : -score.getAsDouble());
                log.debug("Evaluation {}/{}: {} -> {} = {}", evaluations.size(), budget, assignment,
                    options.metric(), score.getAsDouble());
            } else {
                log.debug("Evaluation {}/{}: {} produced no completed runs", evaluations.size(), budget, assignment);
            }
        }

        if (evaluations.isEmpty()) {
            return batchRunner.run(config, List.of(), backtest, runnerOptions);
        }
        return ExperimentResult.combine(evaluations);
    }

    static int budget(ExperimentConfiguration config, SearchOptions options, long spaceSize) {
        int requested = options.callBudget() != null
            ? options.callBudget()
            : config.getMaxCombinations() != null ? config.getMaxCombinations() : SearchOptions.DEFAULT_CALL_BUDGET;
        return (int) Math.min(requested, spaceSize);
    }

    private long propose(ParameterSpace space, Set<Long> tried, List<double[]> points, List<Double> values,
                         SearchOptions options, Random random) {
        SurrogateModel model;
        try {
            model = surrogateBackend.fit(points.toArray(new double[0][]),
                values.stream().mapToDouble(Double::doubleValue).toArray());
        } catch (RuntimeException e) {
            log.warn("⚠️ Surrogate fit failed ({}), proposing a random point", e.getMessage());
            return randomUntried(space.size(), tried, random);
        }

        double best = values.stream().mapToDouble(Double::doubleValue).max().orElse(0);
        long bestIndex = -1;
        double bestAcquisition = Double.NEGATIVE_INFINITY;
        for (long candidate : candidates(space.size(), tried, options.candidatePoolSize(), random)) {
            double acquisition = ExpectedImprovement.of(model.predict(encode(space, candidate)), best,
                ExpectedImprovement.DEFAULT_XI);
            if (acquisition > bestAcquisition) {
                bestAcquisition = acquisition;
                bestIndex = candidate;
            }
        }
        return bestIndex >= 0 ? bestIndex : randomUntried(space.size(), tried, random);
    }

    private static List<Long> candidates(long size, Set<Long> tried, int poolSize, Random random) {
        List<Long> pool = new ArrayList<>();
        long untried = size - tried.size();
        if (untried <= poolSize) {
            for (long i = 0; i < size; i++) {
                if (!tried.contains(i)) {
                    pool.add(i);
                }
            }
            return pool;
        }
        Set<Long> picked = new HashSet<>();
        while (picked.size() < poolSize) {
            long candidate = random.nextLong(size);
            if (!tried.contains(candidate) && picked.add(candidate)) {
                pool.add(candidate);
            }
        }
        return pool;
    }

    private static long randomUntried(long size, Set<Long> tried, Random random) {
        if (size - tried.size() <= 64) {
            List<Long> remaining = candidates(size, tried, Integer.MAX_VALUE, random);
            return remaining.get(random.nextInt(remaining.size()));
        }
        long candidate;
        do {
            candidate = random.nextLong(size);
        } while (tried.contains(candidate));
        return candidate;
    }

    static double[] encode(ParameterSpace space, long index) {
        List<List<Object>> values = space.values();
        double[] point = new double[values.size()];
        long remainder = index;
        for (int i = values.size() - 1; i >= 0; i--) {
            int radix = values.get(i).size();
            int position = (int) (remainder % radix);
            remainder /= radix;
            point[i] = radix == 1 ? 0.5 : (double) position / (radix - 1);
        }
        return point;
    }

    private static OptionalDouble meanObjective(ExperimentResult result, String metric) {
        return result.getRuns().stream()
            .map(run -> run.metric(metric))
            .filter(OptionalDouble::isPresent)
            .mapToDouble(OptionalDouble::getAsDouble)
            .average();
    }
}
