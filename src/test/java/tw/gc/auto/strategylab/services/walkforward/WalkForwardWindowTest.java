package tw.gc.auto.strategylab.services.walkforward;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import tw.gc.auto.strategylab.enums.WindowState;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link WalkForwardWindow}.
 */
class WalkForwardWindowTest {

    private static final LocalDate JAN = LocalDate.of(2023, 1, 1);
    private static final LocalDate JUL = LocalDate.of(2023, 7, 1);
    private static final LocalDate SEP = LocalDate.of(2023, 9, 1);

    private WalkForwardWindow window() {
        return new WalkForwardWindow(0, JAN, JUL, JUL, SEP);
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("should measure both periods in days")
        void shouldMeasurePeriods() {
            WalkForwardWindow window = window();

            assertThat(window.getTrainDays()).isEqualTo(181);
            assertThat(window.getTestDays()).isEqualTo(62);
            assertThat(window.getState()).isEqualTo(WindowState.PENDING);
            assertThat(window.describe()).contains("Window 0").contains("2023-07-01").contains("PENDING");
        }

        @Test
        @DisplayName("should reject inverted or overlapping periods")
        void shouldRejectBadDates() {
            assertThatThrownBy(() -> new WalkForwardWindow(-1, JAN, JUL, JUL, SEP))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new WalkForwardWindow(0, JUL, JAN, JUL, SEP))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new WalkForwardWindow(0, JAN, JUL, SEP, JUL))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new WalkForwardWindow(0, JAN, SEP, JUL, SEP))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not be after testStart");
            assertThatThrownBy(() -> new WalkForwardWindow(0, null, JUL, JUL, SEP))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should move from pending to optimized to validated")
        void shouldAdvance() {
            WalkForwardWindow window = window();

            window.markOptimized(Map.of("period", 20), Map.of("sharpe_ratio", 1.4), 5);

            assertThat(window.getState()).isEqualTo(WindowState.OPTIMIZED);
            assertThat(window.isOptimized()).isTrue();
            assertThat(window.isValidated()).isFalse();
            assertThat(window.getCandidatesEvaluated()).isEqualTo(5);
            assertThat(window.trainMetric("sharpe_ratio")).hasValue(1.4);
            assertThat(window.testMetric("sharpe_ratio")).isEmpty();

            window.markValidated(Map.of("sharpe_ratio", 0.9), 2);

            assertThat(window.getState()).isEqualTo(WindowState.VALIDATED);
            assertThat(window.isValidated()).isTrue();
            assertThat(window.getTestRuns()).isEqualTo(2);
            assertThat(window.testMetric("sharpe_ratio")).hasValue(0.9);
            assertThat(window.getBestParameters()).containsEntry("period", 20);
        }

        @Test
        @DisplayName("should refuse to validate before optimizing or to optimize twice")
        void shouldRejectOutOfOrderTransitions() {
            WalkForwardWindow window = window();

            assertThatThrownBy(() -> window.markValidated(Map.of(), 1)).isInstanceOf(IllegalStateException.class);

            window.markOptimized(Map.of("period", 20), Map.of(), 1);

            assertThatThrownBy(() -> window.markOptimized(Map.of("period", 30), Map.of(), 1))
                .isInstanceOf(IllegalStateException.class);
            assertThat(window.getBestParameters()).containsEntry("period", 20);
        }

        @Test
        @DisplayName("should record a failure without changing the state")
        void shouldRecordFailure() {
            WalkForwardWindow window = window();

            window.recordFailure("no trades");

            assertThat(window.getState()).isEqualTo(WindowState.PENDING);
            assertThat(window.getFailureReason()).isEqualTo("no trades");
            assertThat(window.isOptimized()).isFalse();
        }

        @Test
        @DisplayName("should ignore non-finite metrics")
        void shouldIgnoreNonFiniteMetrics() {
            WalkForwardWindow window = window();

            window.markOptimized(Map.of("period", 20), Map.of("sharpe_ratio", Double.NaN), 1);

            assertThat(window.trainMetric("sharpe_ratio")).isEmpty();
        }
    }
}
