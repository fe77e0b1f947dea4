package tw.gc.auto.strategylab.services.search;

import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.strategylab.enums.SearchMode;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;
import tw.gc.auto.strategylab.services.runner.BacktestFunction;
import tw.gc.auto.strategylab.services.runner.ExperimentResult;

/**
 * The search strategies available to a process, keyed by mode.
 */
@Component
@Slf4j
public class SearchStrategies {

    private final Map<SearchMode, SearchStrategy> byMode = new EnumMap<>(SearchMode.class);

    public SearchStrategies(List<SearchStrategy> strategies) {
        for (SearchStrategy strategy : strategies) {
            if (byMode.put(strategy.mode(), strategy) != null) {
                throw new IllegalStateException("Two search strategies registered for " + strategy.mode());
            }
        }
    }

    /**
     * @throws IllegalArgumentException if no strategy serves the mode
     */
    public SearchStrategy get(SearchMode mode) {
        SearchStrategy strategy = byMode.get(mode);
        if (strategy == null) {
            throw new IllegalArgumentException("No search strategy for mode " + mode);
        }
        return strategy;
    }

    public ExperimentResult search(ExperimentConfiguration config, BacktestFunction backtest, SearchOptions options)
            throws IOException {
        log.info("🎯 Optimizing {} with {} search on {} ({})", config.getExperimentId(), options.mode(),
            options.metric(), options.maximize() ? "maximize" : "minimize");
        return get(options.mode()).search(config, backtest, options);
    }
}
