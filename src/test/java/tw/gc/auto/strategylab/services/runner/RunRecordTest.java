package tw.gc.auto.strategylab.services.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import tw.gc.auto.strategylab.enums.RunStatus;

import static org.assertj.core.api.Assertions.*;
import static tw.gc.auto.strategylab.testutil.ExperimentTestFactory.*;

/**
 * Unit tests for {@link RunRecord}.
 */
class RunRecordTest {

    private RunRecord pending() {
        return new RunRecord("exp-batch-000001", "batch", "exp", "BTCUSDT", Map.of("period", 10));
    }

    @Test
    @DisplayName("should start pending without metrics or error")
    void shouldStartPending() {
        RunRecord run = pending();

        assertThat(run.getStatus()).isEqualTo(RunStatus.PENDING);
        assertThat(run.getAttempts()).isZero();
        assertThat(run.getMetrics()).isNull();
        assertThat(run.getErrorMessage()).isNull();
        assertThat(run.metric(BacktestMetrics.SHARPE_RATIO)).isEmpty();
    }

    @Test
    @DisplayName("should move forward to completed and expose metrics")
    void shouldComplete() {
        RunRecord run = completedRun("r1", Map.of("period", 10), metrics(1.5, 12));

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getStartedAt()).isNotNull();
        assertThat(run.getCompletedAt()).isAfterOrEqualTo(run.getStartedAt());
        assertThat(run.metric(BacktestMetrics.SHARPE_RATIO)).hasValue(1.5);
        assertThat(run.metric(BacktestMetrics.NUM_TRADES)).hasValue(12.0);
        assertThat(run.metric("unknown")).isEmpty();
    }

    @Test
    @DisplayName("should describe failures with the exception type and message")
    void shouldDescribeFailure() {
        RunRecord run = pending();
        run.markRunning();
        run.recordAttempt();

        run.markFailed(new BacktestException("no data"));

        assertThat(run.isFailed()).isTrue();
        assertThat(run.getErrorMessage()).isEqualTo("BacktestException: no data");
        assertThat(run.metric(BacktestMetrics.SHARPE_RATIO)).isEmpty();
    }

    @Test
    @DisplayName("should fall back to the exception type when the message is empty")
    void shouldUseTypeForEmptyMessage() {
        RunRecord run = pending();
        run.markRunning();

        run.markFailed(new NullPointerException());

        assertThat(run.getErrorMessage()).isEqualTo("NullPointerException");
    }

    @Test
    @DisplayName("should never leave a failed run without an error message")
    void shouldRequireErrorText() {
        RunRecord run = pending();
        run.markRunning();

        run.markFailed(" ");

        assertThat(run.getErrorMessage()).isEqualTo("Unknown error");
    }

    @Test
    @DisplayName("should reject backwards and skipped transitions")
    void shouldRejectIllegalTransitions() {
        RunRecord run = pending();

        assertThatThrownBy(() -> run.markCompleted(metrics(1.0, 1))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(run::recordAttempt).isInstanceOf(IllegalStateException.class);

        run.markRunning();
        run.recordAttempt();
        run.markCompleted(metrics(1.0, 1));

        assertThatThrownBy(() -> run.markFailed("late")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(run::markRunning).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should require metrics to complete")
    void shouldRequireMetrics() {
        RunRecord run = pending();
        run.markRunning();

        assertThatThrownBy(() -> run.markCompleted(null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
    }
}
