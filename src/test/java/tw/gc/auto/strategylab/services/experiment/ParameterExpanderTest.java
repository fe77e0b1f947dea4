package tw.gc.auto.strategylab.services.experiment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;

import tw.gc.auto.strategylab.enums.ExpansionMode;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ParameterExpander}.
 */
class ParameterExpanderTest {

    private final ParameterExpander expander = new ParameterExpander();

    private static ExperimentConfiguration.ExperimentConfigurationBuilder config(List<String> symbols,
                                                                               ParameterRange... ranges) {
        return ExperimentConfiguration.builder()
            .name("expander")
            .strategy("test")
            .symbols(symbols)
            .timeframe("1d")
            .parameters(ExperimentConfiguration.rangesOf(ranges));
    }

    @Nested
    @DisplayName("Grid mode")
    class GridTests {

        @Test
        @DisplayName("should produce symbols x cartesian product tasks")
        void shouldProduceCartesianProduct() {
            var cfg = config(List.of("BTC", "ETH"),
                ParameterRange.ofValues("a", List.of(1, 2)),
                ParameterRange.ofValues("b", List.of(10, 20, 30))).build();

            List<Task> tasks = expander.expandTasks(cfg);

            assertThat(tasks).hasSize(12);
            assertThat(new HashSet<>(tasks)).hasSize(12);
            assertThat(tasks.subList(0, 6)).allMatch(t -> t.symbol().equals("BTC"));
            assertThat(tasks.subList(6, 12)).allMatch(t -> t.symbol().equals("ETH"));
        }

        @Test
        @DisplayName("should vary the last parameter fastest")
        void shouldOrderCombinations() {
            var cfg = config(List.of("BTC"),
                ParameterRange.ofValues("a", List.of(1, 2)),
                ParameterRange.ofValues("b", List.of(10, 20))).build();

            assertThat(expander.expandCombinations(cfg)).containsExactly(
                Map.of("a", 1, "b", 10),
                Map.of("a", 1, "b", 20),
                Map.of("a", 2, "b", 10),
                Map.of("a", 2, "b", 20));
        }

        @Test
        @DisplayName("should down-sample by stride to exactly max combinations, reproducibly")
        void shouldDownSampleByStride() {
            var cfg = config(List.of("BTC"),
                ParameterRange.linear("a", 1, 10, 1),
                ParameterRange.linear("b", 1, 10, 1))
                .maxCombinations(7)
                .build();

            List<Map<String, Object>> first = expander.expandCombinations(cfg);
            List<Map<String, Object>> second = expander.expandCombinations(cfg);

            assertThat(first).hasSize(7).doesNotHaveDuplicates();
            assertThat(first).isEqualTo(second);
            // stride 100 / 7 = 14
            assertThat(first.get(0)).isEqualTo(Map.of("a", 1, "b", 1));
            assertThat(first.get(1)).isEqualTo(Map.of("a", 2, "b", 5));
        }

        @Test
        @DisplayName("should keep the full grid when it fits")
        void shouldKeepFullGrid() {
            var cfg = config(List.of("BTC"), ParameterRange.linear("a", 1, 5, 1))
                .maxCombinations(10)
                .build();

            assertThat(expander.expandCombinations(cfg)).hasSize(5);
        }

        @Test
        @DisplayName("should yield one empty assignment without parameters")
        void shouldYieldDefaultsAssignment() {
            var cfg = config(List.of("BTC", "ETH")).build();

            List<Task> tasks = expander.expandTasks(cfg);

            assertThat(tasks).hasSize(2);
            assertThat(tasks).allMatch(t -> t.parameters().isEmpty());
        }

        @Test
        @DisplayName("should treat single-value ranges as a factor of one")
        void shouldHandleSingleValue() {
            var cfg = config(List.of("BTC"),
                ParameterRange.ofValues("a", List.of(1, 2, 3)),
                ParameterRange.ofValues("fixed", List.of("x"))).build();

            assertThat(expander.expandCombinations(cfg)).hasSize(3).allMatch(c -> "x".equals(c.get("fixed")));
        }
    }

    @Nested
    @DisplayName("Random mode")
    class RandomTests {

        @Test
        @DisplayName("should draw sample size distinct assignments")
        void shouldDrawWithoutReplacement() {
            var cfg = config(List.of("BTC"),
                ParameterRange.linear("a", 1, 20, 1),
                ParameterRange.linear("b", 1, 20, 1))
                .expansionMode(ExpansionMode.RANDOM)
                .sampleSize(25)
                .build();

            List<Map<String, Object>> drawn = expander.expandCombinations(cfg, new Random(7));

            assertThat(drawn).hasSize(25).doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("should be reproducible with the same seed")
        void shouldBeSeedable() {
            var cfg = config(List.of("BTC"), ParameterRange.linear("a", 1, 100, 1))
                .expansionMode(ExpansionMode.RANDOM)
                .maxCombinations(10)
                .build();

            assertThat(expander.expandCombinations(cfg, new Random(42)))
                .isEqualTo(expander.expandCombinations(cfg, new Random(42)));
        }

        @Test
        @DisplayName("should cap the draw at the space size")
        void shouldCapDraw() {
            var cfg = config(List.of("BTC"), ParameterRange.ofValues("a", List.of(1, 2, 3)))
                .expansionMode(ExpansionMode.RANDOM)
                .sampleSize(10)
                .build();

            assertThat(expander.expandCombinations(cfg, new Random(1)))
                .containsExactlyInAnyOrder(Map.of("a", 1), Map.of("a", 2), Map.of("a", 3));
        }
    }

    @Nested
    @DisplayName("List mode")
    class ListTests {

        @Test
        @DisplayName("should return the literal combinations unchanged")
        void shouldReturnLiterals() {
            List<Map<String, Object>> literals = List.of(Map.of("a", 1, "b", "x"), Map.of("a", 3, "b", "y"));
            var cfg = config(List.of("BTC", "ETH"),
                ParameterRange.ofValues("a", List.of(1, 2, 3)),
                ParameterRange.ofValues("b", List.of("x", "y")))
                .expansionMode(ExpansionMode.LIST)
                .combinations(literals)
                .build();

            assertThat(expander.expandCombinations(cfg)).isEqualTo(literals);
            assertThat(expander.expandTasks(cfg)).hasSize(4);
        }
    }
}
