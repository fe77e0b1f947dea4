package tw.gc.auto.strategylab.services.runner;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

import lombok.AccessLevel;
import lombok.Getter;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;

/**
 * Outcome of one or more batches of an experiment.
 *
 * <p>Totals and the best run are derived from the run records. When the batch ran with
 * {@code retainRuns = false}, {@link #getRuns()} only holds the records that were not yet
 * flushed and the run log is the authoritative record set; totals, statistics and the best
 * run still cover every run.
 */
@Getter
public final class ExperimentResult {

    private final String experimentId;
    private final ExperimentConfiguration configuration;
    private final List<RunRecord> runs;
    private final int requestedRuns;
    private final int completedRuns;
    private final int failedRuns;
    private final boolean aborted;
    private final String rankingMetric;
    private final boolean maximize;
    private final List<String> batchIds;
    private final Instant startedAt;
    private final Instant completedAt;
    private final boolean runsRetained;

    @Getter(AccessLevel.NONE)
    private final RunTally tally;

    ExperimentResult(ExperimentConfiguration configuration, List<RunRecord> runs, RunTally tally,
                     int requestedRuns, boolean aborted, List<String> batchIds,
                     Instant startedAt, Instant completedAt, boolean runsRetained) {
        this.experimentId = configuration.getExperimentId();
        this.configuration = configuration;
        this.runs = Collections.unmodifiableList(new ArrayList<>(runs));
        this.tally = tally;
        this.requestedRuns = requestedRuns;
        this.completedRuns = tally.completed();
        this.failedRuns = tally.failed();
        this.aborted = aborted;
        this.rankingMetric = tally.rankingMetric();
        this.maximize = tally.maximize();
        this.batchIds = List.copyOf(batchIds);
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.runsRetained = runsRetained;
    }

    /**
     * Derives a result from a complete set of run records.
     */
    public static ExperimentResult fromRuns(ExperimentConfiguration configuration, List<RunRecord> runs,
                                            String rankingMetric, boolean maximize) {
        Instant started = runs.stream().map(RunRecord::getStartedAt).filter(Objects::nonNull)
            .min(Comparator.naturalOrder()).orElse(null);
        Instant completed = runs.stream().map(RunRecord::getCompletedAt).filter(Objects::nonNull)
            .max(Comparator.naturalOrder()).orElse(null);
        return restore(configuration, runs, rankingMetric, maximize, runs.size(), false, started, completed);
    }

    /**
     * Rebuilds a persisted result whose request count and abort flag are known.
     */
    public static ExperimentResult restore(ExperimentConfiguration configuration, List<RunRecord> runs,
                                           String rankingMetric, boolean maximize, int requestedRuns,
                                           boolean aborted, Instant startedAt, Instant completedAt) {
        RunTally tally = new RunTally(rankingMetric, maximize);
        Set<String> batchIds = new LinkedHashSet<>();
        for (RunRecord run : runs) {
            tally.add(run);
            if (run.getBatchId() != null) {
                batchIds.add(run.getBatchId());
            }
        }
        return new ExperimentResult(configuration, runs, tally, Math.max(requestedRuns, runs.size()), aborted,
            new ArrayList<>(batchIds), startedAt, completedAt, true);
    }

    /**
     * Merges results of several batches of the same experiment.
     *
     * @throws IllegalArgumentException if the list is empty or mixes experiments
     */
    public static ExperimentResult combine(List<ExperimentResult> results) {
        if (results.isEmpty()) {
            throw new IllegalArgumentException("Nothing to combine");
        }
        ExperimentResult first = results.get(0);
        List<RunRecord> runs = new ArrayList<>();
        List<String> batchIds = new ArrayList<>();
        RunTally tally = new RunTally(first.rankingMetric, first.maximize);
        int requested = 0;
        boolean aborted = false;
        boolean retained = true;
        Instant started = null;
        Instant completed = null;
        for (ExperimentResult result : results) {
            if (!result.experimentId.equals(first.experimentId)) {
                throw new IllegalArgumentException("Cannot combine results of %s and %s"
                    .formatted(first.experimentId, result.experimentId));
            }
            runs.addAll(result.runs);
            batchIds.addAll(result.batchIds);
            tally = tally.merge(result.tally);
            requested += result.requestedRuns;
            aborted |= result.aborted;
            retained &= result.runsRetained;
            started = earliest(started, result.startedAt);
            completed = latest(completed, result.completedAt);
        }
        return new ExperimentResult(first.configuration, runs, tally, requested, aborted, batchIds,
            started, completed, retained);
    }

    /**
     * Runs that were requested but never dispatched, because fail-fast stopped the batch.
     */
    public int getCancelledRuns() {
        return Math.max(0, requestedRuns - completedRuns - failedRuns);
    }

    public Duration getDuration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }

    /**
     * Best completed run under the ranking metric the batch was run with.
     */
    public Optional<RunRecord> bestRun() {
        return Optional.ofNullable(tally.bestRun());
    }

    /**
     * Best retained completed run under any core or extension metric. Runs missing the metric
     * or reporting a non-finite value are ignored.
     */
    public Optional<RunRecord> bestRun(String metric, boolean maximizeMetric) {
        Comparator<RunRecord> byMetric = Comparator.comparingDouble(r -> r.metric(metric).getAsDouble());
        var candidates = runs.stream().filter(r -> r.metric(metric).isPresent());
        return maximizeMetric ? candidates.max(byMetric) : candidates.min(byMetric);
    }

    public OptionalDouble bestValue() {
        return bestRun().map(run -> run.metric(rankingMetric)).orElse(OptionalDouble.empty());
    }

    public ExperimentStatistics statistics() {
        return tally.statistics(completedRuns + failedRuns);
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isBefore(b) ? a : b;
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isAfter(b) ? a : b;
    }

    @Override
    public String toString() {
        return "ExperimentResult[%s, requested=%d, completed=%d, failed=%d, aborted=%s]"
            .formatted(experimentId, requestedRuns, completedRuns, failedRuns, aborted);
    }
}
