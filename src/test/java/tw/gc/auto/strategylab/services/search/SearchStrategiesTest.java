package tw.gc.auto.strategylab.services.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import tw.gc.auto.strategylab.enums.SearchMode;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;
import tw.gc.auto.strategylab.services.experiment.ParameterRange;
import tw.gc.auto.strategylab.services.runner.BacktestFunction;
import tw.gc.auto.strategylab.services.runner.BacktestMetrics;
import tw.gc.auto.strategylab.services.runner.ExperimentResult;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;
import static tw.gc.auto.strategylab.testutil.ExperimentTestFactory.*;

/**
 * Unit tests for {@link SearchStrategies}.
 */
class SearchStrategiesTest {

    private SearchStrategy strategy(SearchMode mode) {
        SearchStrategy strategy = mock(SearchStrategy.class);
        when(strategy.mode()).thenReturn(mode);
        return strategy;
    }

    @Test
    @DisplayName("should dispatch to the strategy of the requested mode")
    void shouldDispatchByMode() throws Exception {
        SearchStrategy grid = strategy(SearchMode.GRID);
        SearchStrategy random = strategy(SearchMode.RANDOM);
        ExperimentConfiguration config = config("dispatch", List.of("BTCUSDT"), ParameterRange.linear("p", 1, 3, 1));
        BacktestFunction backtest = peakAt("p", 2);
        SearchOptions options = SearchOptions.defaults().withMode(SearchMode.RANDOM);
        ExperimentResult expected = ExperimentResult.fromRuns(config, List.of(), BacktestMetrics.SHARPE_RATIO, true);
        when(random.search(config, backtest, options)).thenReturn(expected);

        SearchStrategies strategies = new SearchStrategies(List.of(grid, random));

        assertThat(strategies.search(config, backtest, options)).isSameAs(expected);
        verify(grid, never()).search(any(), any(), any());
    }

    @Test
    @DisplayName("should reject an unknown mode")
    void shouldRejectUnknownMode() {
        SearchStrategies strategies = new SearchStrategies(List.of(strategy(SearchMode.GRID)));

        assertThatThrownBy(() -> strategies.get(SearchMode.MODEL_BASED))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("MODEL_BASED");
    }

    @Test
    @DisplayName("should reject two strategies for one mode")
    void shouldRejectDuplicates() {
        assertThatThrownBy(() -> new SearchStrategies(List.of(strategy(SearchMode.GRID), strategy(SearchMode.GRID))))
            .isInstanceOf(IllegalStateException.class);
    }
}
