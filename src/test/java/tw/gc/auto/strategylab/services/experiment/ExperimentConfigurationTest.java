package tw.gc.auto.strategylab.services.experiment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import tw.gc.auto.strategylab.enums.ExpansionMode;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ExperimentConfiguration}.
 */
class ExperimentConfigurationTest {

    private static ExperimentConfiguration.ExperimentConfigurationBuilder base() {
        return ExperimentConfiguration.builder()
            .name("ma cross")
            .strategy("ma_cross")
            .symbols(List.of("BTCUSDT", "ETHUSDT"))
            .timeframe("1h")
            .parameters(ExperimentConfiguration.rangesOf(
                ParameterRange.linear("fast", 5, 20, 5),
                ParameterRange.ofValues("slow", List.of(50, 100))));
    }

    @Nested
    @DisplayName("Experiment id")
    class IdTests {

        @Test
        @DisplayName("should derive the same id for equal configurations")
        void shouldBeDeterministic() {
            var first = base().build();
            var second = base().build();

            assertThat(first.getExperimentId()).isEqualTo(second.getExperimentId());
            assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        }

        @Test
        @DisplayName("should prefix the id with a file-system safe name")
        void shouldPrefixWithSafeName() {
            assertThat(base().build().getExperimentId()).matches("ma_cross_[0-9a-f]{12}");
        }

        @Test
        @DisplayName("should ignore symbol and parameter declaration order")
        void shouldIgnoreOrder() {
            var reordered = base()
                .symbols(List.of("ETHUSDT", "BTCUSDT"))
                .parameters(ExperimentConfiguration.rangesOf(
                    ParameterRange.ofValues("slow", List.of(50, 100)),
                    ParameterRange.linear("fast", 5, 20, 5)))
                .build();

            assertThat(reordered.getExperimentId()).isEqualTo(base().build().getExperimentId());
        }

        @Test
        @DisplayName("should tell a numeric value from the same digits as text")
        void shouldDistinguishNumbersFromStrings() {
            var numbers = base()
                .parameters(ExperimentConfiguration.rangesOf(ParameterRange.ofValues("slow", List.of(10))))
                .build();
            var strings = base()
                .parameters(ExperimentConfiguration.rangesOf(ParameterRange.ofValues("slow", List.of("10"))))
                .build();

            assertThat(strings.getExperimentId()).isNotEqualTo(numbers.getExperimentId());
        }

        @Test
        @DisplayName("should treat 100 and 100.0 as the same value")
        void shouldNormalizeNumbers() {
            var doubles = base()
                .parameters(ExperimentConfiguration.rangesOf(
                    ParameterRange.linear("fast", 5, 20, 5),
                    ParameterRange.ofValues("slow", List.of(50.0, 100.0))))
                .build();

            assertThat(doubles.getExperimentId()).isEqualTo(base().build().getExperimentId());
        }

        @Test
        @DisplayName("should change when any field changes")
        void shouldChangeWithFields() {
            String id = base().build().getExperimentId();

            assertThat(base().name("ma cross 2").build().getExperimentId()).isNotEqualTo(id);
            assertThat(base().strategy("ema_cross").build().getExperimentId()).isNotEqualTo(id);
            assertThat(base().symbols(List.of("BTCUSDT")).build().getExperimentId()).isNotEqualTo(id);
            assertThat(base().timeframe("4h").build().getExperimentId()).isNotEqualTo(id);
            assertThat(base().maxCombinations(3).build().getExperimentId()).isNotEqualTo(id);
            assertThat(base().expansionMode(ExpansionMode.RANDOM).build().getExperimentId()).isNotEqualTo(id);
            assertThat(base().executionDefaults(new ExecutionDefaults(20_000, 0.0005, 1.0, null, null))
                .build().getExperimentId()).isNotEqualTo(id);
            assertThat(base().parameters(ExperimentConfiguration.rangesOf(
                    ParameterRange.linear("fast", 5, 25, 5),
                    ParameterRange.ofValues("slow", List.of(50, 100))))
                .build().getExperimentId()).isNotEqualTo(id);
        }

        @Test
        @DisplayName("should change with the backtest period")
        void shouldChangeWithPeriod() {
            var config = base().build();
            var sliced = config.withPeriod(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 7, 1));

            assertThat(sliced.getExperimentId()).isNotEqualTo(config.getExperimentId());
            assertThat(sliced.getStartDate()).isEqualTo(LocalDate.of(2023, 1, 1));
            assertThat(sliced.getParameters()).isEqualTo(config.getParameters());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should apply defaults")
        void shouldApplyDefaults() {
            var config = base().build();

            assertThat(config.getExpansionMode()).isEqualTo(ExpansionMode.GRID);
            assertThat(config.getExecutionDefaults()).isEqualTo(ExecutionDefaults.defaults());
            assertThat(config.getDescription()).isEmpty();
            assertThat(config.getTags()).isEmpty();
        }

        @Test
        @DisplayName("should reject missing symbols")
        void shouldRejectEmptySymbols() {
            assertThatThrownBy(() -> base().symbols(List.of()).build())
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("symbols");
        }

        @Test
        @DisplayName("should reject duplicate symbols")
        void shouldRejectDuplicateSymbols() {
            assertThatThrownBy(() -> base().symbols(List.of("BTCUSDT", "BTCUSDT")).build())
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("Duplicate symbol");
        }

        @Test
        @DisplayName("should reject blank strategy")
        void shouldRejectBlankStrategy() {
            assertThatThrownBy(() -> base().strategy("").build())
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("strategy");
        }

        @Test
        @DisplayName("should reject non-positive max combinations")
        void shouldRejectZeroMax() {
            assertThatThrownBy(() -> base().maxCombinations(0).build())
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("max_combinations");
        }

        @Test
        @DisplayName("should reject list mode without combinations")
        void shouldRejectEmptyList() {
            assertThatThrownBy(() -> base().expansionMode(ExpansionMode.LIST).build())
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("combinations");
        }

        @Test
        @DisplayName("should reject combinations using undeclared parameters")
        void shouldRejectUndeclaredParameter() {
            assertThatThrownBy(() -> base()
                    .expansionMode(ExpansionMode.LIST)
                    .combinations(List.of(Map.of("fast", 5, "medium", 20)))
                    .build())
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("medium");
        }

        @Test
        @DisplayName("should reject a period ending before it starts")
        void shouldRejectReversedPeriod() {
            assertThatThrownBy(() -> base()
                    .startDate(LocalDate.of(2024, 1, 1))
                    .endDate(LocalDate.of(2023, 1, 1))
                    .build())
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("start_date");
        }
    }
}
