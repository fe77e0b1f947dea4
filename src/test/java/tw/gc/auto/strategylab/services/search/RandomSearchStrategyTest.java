package tw.gc.auto.strategylab.services.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import tw.gc.auto.strategylab.enums.ExpansionMode;
import tw.gc.auto.strategylab.enums.SearchMode;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;
import tw.gc.auto.strategylab.services.experiment.ParameterExpander;
import tw.gc.auto.strategylab.services.experiment.ParameterRange;
import tw.gc.auto.strategylab.services.runner.BacktestFunction;
import tw.gc.auto.strategylab.services.runner.BacktestMetrics;
import tw.gc.auto.strategylab.services.runner.BatchRunner;
import tw.gc.auto.strategylab.services.runner.ExperimentResult;
import tw.gc.auto.strategylab.services.runner.RunRecord;
import tw.gc.auto.strategylab.services.runner.RunnerOptions;

import static org.assertj.core.api.Assertions.*;
import static tw.gc.auto.strategylab.testutil.ExperimentTestFactory.*;

/**
 * Unit tests for {@link RandomSearchStrategy}.
 */
class RandomSearchStrategyTest {

    private final BatchRunner batchRunner = new BatchRunner(null,
        RunnerOptions.defaults().toBuilder().retryDelay(Duration.ofMillis(1)).build());
    private final RandomSearchStrategy strategy = new RandomSearchStrategy(new ParameterExpander(), batchRunner);

    private ExperimentConfiguration grid(int sampleSize) {
        return builder("random", List.of("BTCUSDT"),
                ParameterRange.linear("a", 1, 10, 1),
                ParameterRange.linear("b", 1, 10, 1))
            .sampleSize(sampleSize)
            .build();
    }

    private SearchOptions random() {
        return SearchOptions.defaults().toBuilder().mode(SearchMode.RANDOM).seed(7L).build();
    }

    @Nested
    @DisplayName("Sampling")
    class SamplingTests {

        @Test
        @DisplayName("should evaluate the sample in one batch without early stopping")
        void shouldRunWholeSample() throws Exception {
            ExperimentResult result = strategy.search(grid(30), peakAt("a", 5), random());

            assertThat(result.getCompletedRuns()).isEqualTo(30);
            assertThat(result.getBatchIds()).hasSize(1);
            assertThat(result.getConfiguration().getExpansionMode()).isEqualTo(ExpansionMode.RANDOM);
            assertThat(result.getRuns().stream().map(RunRecord::getParameters).distinct()).hasSize(30);
        }

        @Test
        @DisplayName("should draw the same sample for the same seed")
        void shouldBeReproducible() throws Exception {
            ExperimentResult first = strategy.search(grid(10), peakAt("a", 5), random());
            ExperimentResult second = strategy.search(grid(10), peakAt("a", 5), random());

            List<Map<String, Object>> firstParams = first.getRuns().stream().map(RunRecord::getParameters).toList();
            List<Map<String, Object>> secondParams = second.getRuns().stream().map(RunRecord::getParameters).toList();
            assertThat(secondParams).containsExactlyInAnyOrderElementsOf(firstParams);
        }

        @Test
        @DisplayName("should only run the listed combinations in list mode")
        void shouldKeepListedCombinations() throws Exception {
            var config = builder("listed", List.of("BTCUSDT"), ParameterRange.linear("period", 1, 10, 1))
                .expansionMode(ExpansionMode.LIST)
                .combinations(List.of(Map.of("period", 1), Map.of("period", 2)))
                .build();

            ExperimentResult result = strategy.search(config, peakAt("period", 2), random());

            assertThat(result.getConfiguration().getExpansionMode()).isEqualTo(ExpansionMode.LIST);
            assertThat(result.getExperimentId()).isEqualTo(config.getExperimentId());
            assertThat(result.getRuns()).extracting(RunRecord::getParameters)
                .containsExactlyInAnyOrder(Map.of("period", 1), Map.of("period", 2));
        }

        @Test
        @DisplayName("should sample listed combinations without replacement up to the sample size")
        void shouldSampleListedCombinations() throws Exception {
            List<Map<String, Object>> listed = List.of(
                Map.of("fast", 5, "slow", 20),
                Map.of("fast", 10, "slow", 30),
                Map.of("fast", 15, "slow", 40));
            var config = builder("listed only", List.of("BTCUSDT"))
                .expansionMode(ExpansionMode.LIST)
                .combinations(listed)
                .sampleSize(2)
                .build();

            ExperimentResult result = strategy.search(config, peakAt("fast", 10), random());

            assertThat(result.getCompletedRuns()).isEqualTo(2);
            assertThat(result.getRuns()).extracting(RunRecord::getParameters)
                .doesNotHaveDuplicates()
                .allSatisfy(params -> assertThat(listed).contains(params));
        }
    }

    @Nested
    @DisplayName("Early stopping")
    class EarlyStoppingTests {

        @Test
        @DisplayName("should stop once more than patience batches bring no improvement")
        void shouldStopOnPlateau() throws Exception {
            BacktestFunction flat = (symbol, timeframe, parameters, cfg) -> metrics(1.0, 20);
            var options = random().toBuilder()
                .earlyStopping(true)
                .batchSize(5)
                .patience(2)
                .build();

            ExperimentResult result = strategy.search(grid(100), flat, options);

            // first batch sets the best, the next three stagnate
            assertThat(result.getBatchIds()).hasSize(4);
            assertThat(result.getCompletedRuns()).isEqualTo(20);
        }

        @Test
        @DisplayName("should run every batch while the objective keeps improving")
        void shouldContinueWhileImproving() throws Exception {
            var options = random().toBuilder()
                .earlyStopping(true)
                .batchSize(10)
                .patience(0)
                .minImprovement(0.0)
                .build();
            var counter = new AtomicInteger();
            BacktestFunction rising = (symbol, timeframe, parameters, cfg) ->
                metrics(counter.incrementAndGet(), 20);
            var sequential = new RandomSearchStrategy(new ParameterExpander(), new BatchRunner(null,
                RunnerOptions.defaults().toBuilder().maxWorkers(1).build()));

            ExperimentResult result = sequential.search(grid(40), rising, options);

            assertThat(result.getBatchIds()).hasSize(4);
            assertThat(result.getCompletedRuns()).isEqualTo(40);
        }

        @Test
        @DisplayName("should count a batch as progress only above the minimum improvement")
        void shouldRespectMinImprovement() {
            var options = random().toBuilder().patience(1).minImprovement(0.1).build();
            var stopping = new RandomSearchStrategy.EarlyStopping(options);

            assertThat(stopping.shouldStop(resultWithBest(1.0))).isFalse();
            assertThat(stopping.shouldStop(resultWithBest(1.05))).isFalse();
            assertThat(stopping.stagnantBatches()).isEqualTo(1);
            assertThat(stopping.shouldStop(resultWithBest(1.2))).isFalse();
            assertThat(stopping.stagnantBatches()).isZero();
            assertThat(stopping.best()).isEqualTo(1.2);
            assertThat(stopping.shouldStop(resultWithBest(1.2))).isFalse();
            assertThat(stopping.shouldStop(resultWithBest(1.25))).isTrue();
        }

        @Test
        @DisplayName("should not judge progress before two runs completed")
        void shouldWaitForTwoRuns() {
            var stopping = new RandomSearchStrategy.EarlyStopping(random().toBuilder().patience(0).build());
            var config = grid(10);
            var single = ExperimentResult.fromRuns(config,
                List.of(completedRun("r1", Map.of("a", 1, "b", 1), metrics(1.0, 10))),
                BacktestMetrics.SHARPE_RATIO, true);

            assertThat(stopping.shouldStop(single)).isFalse();
            assertThat(stopping.best()).isNull();
        }
    }

    private ExperimentResult resultWithBest(double sharpe) {
        var runs = List.of(
            completedRun("r1", Map.of("a", 1, "b", 1), metrics(sharpe, 10)),
            completedRun("r2", Map.of("a", 2, "b", 1), metrics(sharpe - 1, 10)));
        return ExperimentResult.fromRuns(grid(10), runs, BacktestMetrics.SHARPE_RATIO, true);
    }
}
