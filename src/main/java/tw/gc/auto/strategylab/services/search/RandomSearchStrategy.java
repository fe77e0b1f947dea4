package tw.gc.auto.strategylab.services.search;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Random;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.strategylab.enums.ExpansionMode;
import tw.gc.auto.strategylab.enums.SearchMode;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;
import tw.gc.auto.strategylab.services.experiment.ParameterExpander;
import tw.gc.auto.strategylab.services.experiment.Task;
import tw.gc.auto.strategylab.services.runner.BacktestFunction;
import tw.gc.auto.strategylab.services.runner.BatchRunner;
import tw.gc.auto.strategylab.services.runner.ExperimentResult;
import tw.gc.auto.strategylab.services.runner.RunnerOptions;

/**
 * Random sampling of the parameter space, executed in fixed-size batches.
 *
 * <p>With early stopping enabled, the running best is compared after every batch. A batch
 * counts as progress only if it moves the best by more than {@code minImprovement}; the search
 * stops once more than {@code patience} consecutive batches made no progress.
 *
 * <p>A configuration in list mode is searched over its literal combinations only.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RandomSearchStrategy implements SearchStrategy {

    private final ParameterExpander parameterExpander;
    private final BatchRunner batchRunner;

    @Override
    public SearchMode mode() {
        return SearchMode.RANDOM;
    }

    @Override
    public ExperimentResult search(ExperimentConfiguration config, BacktestFunction backtest, SearchOptions options)
            throws IOException {
        ExperimentConfiguration randomConfig;
        List<Task> tasks;
        if (config.getExpansionMode() == ExpansionMode.LIST) {
            randomConfig = config;
            tasks = ParameterExpander.tasksFor(config.getSymbols(), sampleListed(config, options.random()));
        } else {
            randomConfig = config.getExpansionMode() == ExpansionMode.RANDOM
                ? config
                : config.withExpansionMode(ExpansionMode.RANDOM);
            tasks = parameterExpander.expandTasks(randomConfig, options.random());
        }
        RunnerOptions runnerOptions = options.applyTo(batchRunner.getDefaultOptions());

        if (!options.earlyStopping() || tasks.isEmpty()) {
            log.info("🎲 Random search over {} tasks for {}", tasks.size(), randomConfig.getExperimentId());
            return batchRunner.run(randomConfig, tasks, backtest, runnerOptions);
        }

        int batchSize = options.batchSize();
        int batchCount = (tasks.size() + batchSize - 1) / batchSize;
        log.info("🎲 Random search over {} tasks in {} batches of {} (patience {}, min improvement {})",
            tasks.size(), batchCount, batchSize, options.patience(), options.minImprovement());

        List<ExperimentResult> batches = new ArrayList<>();
        EarlyStopping stopping = new EarlyStopping(options);
        for (int start = 0; start < tasks.size(); start += batchSize) {
            List<Task> batch = tasks.subList(start, Math.min(start + batchSize, tasks.size()));
            ExperimentResult result = batchRunner.run(randomConfig, batch, backtest, runnerOptions);
            batches.add(result);

            ExperimentResult combined = ExperimentResult.combine(batches);
            if (stopping.shouldStop(combined)) {
                log.info("⏹️ Early stop after {}/{} batches ({} of {} tasks run), best {} = {}",
                    batches.size(), batchCount, start + batch.size(), tasks.size(), options.metric(),
                    stopping.best());
                break;
            }
        }
        return ExperimentResult.combine(batches);
    }

    /**
     * Listed combinations in random order, capped by {@code sample_size} (or
     * {@code max_combinations}). Nothing outside the list is ever drawn.
     */
    static List<Map<String, Object>> sampleListed(ExperimentConfiguration config, Random random) {
        List<Map<String, Object>> listed = new ArrayList<>(config.getCombinations());
        Collections.shuffle(listed, random);
        Integer cap = config.getSampleSize() != null ? config.getSampleSize() : config.getMaxCombinations();
        return cap == null || cap >= listed.size() ? listed : listed.subList(0, cap);
    }

    /**
     * Tracks consecutive batches without meaningful improvement of the running best.
     */
    static final class EarlyStopping {
        private final SearchOptions options;
        private Double best;
        private int stagnantBatches;

        EarlyStopping(SearchOptions options) {
            this.options = options;
        }

        boolean shouldStop(ExperimentResult soFar) {
            if (soFar.getCompletedRuns() < 2) {
                return false;
            }
            OptionalDouble current = soFar.bestValue();
            if (current.isEmpty()) {
                return false;
            }
            double value = current.getAsDouble();
            double improvement = best == null
                ? Double.POSITIVE_INFINITY
                : (options.maximize() ? value - best : best - value);
            if (improvement > options.minImprovement()) {
                best = value;
                stagnantBatches = 0;
                log.debug("New best {} = {}", options.metric(), value);
            } else {
                stagnantBatches++;
            }
            return stagnantBatches > options.patience();
        }

        Double best() {
            return best;
        }

        int stagnantBatches() {
            return stagnantBatches;
        }
    }
}
