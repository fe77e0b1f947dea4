package tw.gc.auto.strategylab.services.runner;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.Getter;
import tw.gc.auto.strategylab.enums.RunStatus;

/**
 * A single backtest run of one symbol with one parameter assignment.
 *
 * <p>Status only moves forward (PENDING → RUNNING → COMPLETED | FAILED). A record is owned by
 * the worker executing it until it reaches a terminal state; afterwards it is only read.
 * {@code errorMessage} is non-empty exactly when the run failed.
 */
@Getter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunRecord {

    private final String runId;
    private final String batchId;
    private final String experimentId;
    private final String symbol;
    private final Map<String, Object> parameters;
    private RunStatus status;
    private Instant startedAt;
    private Instant completedAt;
    private int attempts;
    private BacktestMetrics metrics;
    private String errorMessage;

    public RunRecord(String runId, String batchId, String experimentId, String symbol, Map<String, Object> parameters) {
        this.runId = runId;
        this.batchId = batchId;
        this.experimentId = experimentId;
        this.symbol = symbol;
        this.parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.status = RunStatus.PENDING;
    }

    /**
     * Rebuilds a record read back from the run log or a summary.
     */
    @JsonCreator
    public static RunRecord restore(
            @JsonProperty("run_id") String runId,
            @JsonProperty("batch_id") String batchId,
            @JsonProperty("experiment_id") String experimentId,
            @JsonProperty("symbol") String symbol,
            @JsonProperty("parameters") Map<String, Object> parameters,
            @JsonProperty("status") RunStatus status,
            @JsonProperty("started_at") Instant startedAt,
            @JsonProperty("completed_at") Instant completedAt,
            @JsonProperty("attempts") int attempts,
            @JsonProperty("metrics") BacktestMetrics metrics,
            @JsonProperty("error_message") String errorMessage) {
        RunRecord run = new RunRecord(runId, batchId, experimentId, symbol, parameters);
        run.status = status != null ? status : RunStatus.PENDING;
        run.startedAt = startedAt;
        run.completedAt = completedAt;
        run.attempts = attempts;
        run.metrics = metrics;
        run.errorMessage = errorMessage;
        return run;
    }

    public void markRunning() {
        transition(RunStatus.RUNNING);
        this.startedAt = Instant.now();
    }

    public void recordAttempt() {
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Run %s is not running (status: %s)".formatted(runId, status));
        }
        this.attempts++;
    }

    public void markCompleted(BacktestMetrics result) {
        if (result == null) {
            throw new IllegalArgumentException("Completed run " + runId + " needs metrics");
        }
        transition(RunStatus.COMPLETED);
        this.metrics = result;
        this.completedAt = Instant.now();
    }

    public void markFailed(Throwable cause) {
        String text = cause.getMessage() == null || cause.getMessage().isBlank()
            ? cause.getClass().getSimpleName()
            : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        markFailed(text);
    }

    public void markFailed(String message) {
        transition(RunStatus.FAILED);
        this.errorMessage = message == null || message.isBlank() ? "Unknown error" : message;
        this.completedAt = Instant.now();
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == RunStatus.FAILED;
    }

    /**
     * Metric value of a completed run; empty for failed runs and unknown metrics.
     */
    public OptionalDouble metric(String name) {
        return isCompleted() && metrics != null ? metrics.value(name) : OptionalDouble.empty();
    }

    private void transition(RunStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Run %s cannot move from %s to %s".formatted(runId, status, next));
        }
        this.status = next;
    }

    @Override
    public String toString() {
        return "RunRecord[%s, %s, %s, %s]".formatted(runId, symbol, parameters, status);
    }
}
