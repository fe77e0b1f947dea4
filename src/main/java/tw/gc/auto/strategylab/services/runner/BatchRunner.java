package tw.gc.auto.strategylab.services.runner;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.strategylab.services.experiment.ExperimentConfiguration;
import tw.gc.auto.strategylab.services.experiment.Task;
import tw.gc.auto.strategylab.services.storage.ExperimentStorage;

/**
 * Executes a task list against a {@link BacktestFunction} on a fixed-size worker pool.
 *
 * <p>Single-owner pattern:
 * <ul>
 *   <li>Workers only run backtests and push finished {@link RunRecord}s onto a queue</li>
 *   <li>The calling thread is the only consumer: it tallies results, appends them to the
 *       run log every {@code flushEvery} records and dispatches the next task</li>
 * </ul>
 *
 * <p>At most {@code maxWorkers} tasks are in flight and a new one is only dispatched after a
 * finished record was consumed. Under fail-fast the first failed record stops dispatching,
 * so no more than {@code maxWorkers + 1} tasks are ever started; tasks already running finish
 * on their own.
 *
 * <p>Backtest failures are captured on the record and never leave this class. Only I/O errors
 * of the run log propagate.
 */
@Service
@Slf4j
public class BatchRunner {

    private final ExperimentStorage storage;
    private final RunnerOptions defaultOptions;

    public BatchRunner(ExperimentStorage storage, RunnerOptions defaultOptions) {
        this.storage = storage;
        this.defaultOptions = defaultOptions != null ? defaultOptions : RunnerOptions.defaults();
    }

    public RunnerOptions getDefaultOptions() {
        return defaultOptions;
    }

    public ExperimentResult run(ExperimentConfiguration config, List<Task> tasks, BacktestFunction backtest)
            throws IOException {
        return run(config, tasks, backtest, defaultOptions, BatchProgressListener.NONE);
    }

    public ExperimentResult run(ExperimentConfiguration config, List<Task> tasks, BacktestFunction backtest,
                                RunnerOptions options) throws IOException {
        return run(config, tasks, backtest, options, BatchProgressListener.NONE);
    }

    /**
     * Runs every task once (plus retries) and returns the derived result.
     *
     * @throws IOException if the run log cannot be written
     */
    public ExperimentResult run(ExperimentConfiguration config, List<Task> tasks, BacktestFunction backtest,
                                RunnerOptions options, BatchProgressListener listener) throws IOException {
        if (!options.retainRuns() && storage == null) {
            throw new IllegalStateException("retainRuns=false needs storage for the run log");
        }
        BatchProgressListener progress = listener != null ? listener : BatchProgressListener.NONE;
        String experimentId = config.getExperimentId();
        String batchId = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        int total = tasks.size();
        int workers = Math.max(1, Math.min(options.maxWorkers(), total));
        Instant startedAt = Instant.now();

        log.info("🚀 Starting batch {} of {}: {} tasks on {} workers", batchId, experimentId, total, workers);

        RunTally tally = new RunTally(options.rankingMetric(), options.maximize());
        List<RunRecord> retained = new ArrayList<>();
        List<RunRecord> unflushed = new ArrayList<>();
        BlockingQueue<RunRecord> finished = new LinkedBlockingQueue<>();
        int flushedTotal = 0;
        int dispatched = 0;
        int inFlight = 0;
        boolean aborted = false;

        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreads(batchId));
        try {
            while (dispatched < Math.min(workers, total)) {
                submit(executor, config, tasks.get(dispatched), runId(experimentId, batchId, dispatched),
                    batchId, backtest, options, finished);
                dispatched++;
                inFlight++;
            }

            while (inFlight > 0) {
                RunRecord run;
                try {
                    run = finished.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("⚠️ Batch {} interrupted with {} runs in flight", batchId, inFlight);
                    aborted = true;
                    executor.shutdownNow();
                    break;
                }
                inFlight--;

                tally.add(run);
                unflushed.add(run);
                if (options.retainRuns()) {
                    retained.add(run);
                }
                progress.onRunCompleted(run, tally.completed() + tally.failed(), total, tally.failed());
                if (run.isFailed()) {
                    log.debug("Run {} failed after {} attempts: {}", run.getRunId(), run.getAttempts(), run.getErrorMessage());
                } else {
                    log.debug("Run {} completed ({}/{})", run.getRunId(), tally.completed() + tally.failed(), total);
                }

                if (storage != null && unflushed.size() >= options.flushEvery()) {
                    flushedTotal += flush(experimentId, unflushed, flushedTotal, progress);
                }

                if (run.isFailed() && options.failFast() && !aborted) {
                    aborted = true;
                    int cancelled = total - dispatched;
                    log.warn("⚠️ Fail-fast: run {} failed, {} pending tasks cancelled", run.getRunId(), cancelled);
                    progress.onAborted(run, cancelled);
                }

                if (!aborted && dispatched < total) {
                    submit(executor, config, tasks.get(dispatched), runId(experimentId, batchId, dispatched),
                        batchId, backtest, options, finished);
                    dispatched++;
                    inFlight++;
                }
            }

            if (storage != null && !unflushed.isEmpty()) {
                flushedTotal += flush(experimentId, unflushed, flushedTotal, progress);
            }
        } finally {
            executor.shutdown();
        }

        ExperimentResult result = new ExperimentResult(config,
            options.retainRuns() ? retained : unflushed,
            tally, total, aborted, List.of(batchId), startedAt, Instant.now(), options.retainRuns());

        log.info("✅ Batch {} completed: {} completed, {} failed, {} cancelled in {} ms",
            batchId, result.getCompletedRuns(), result.getFailedRuns(), result.getCancelledRuns(),
            result.getDuration().toMillis());
        return result;
    }

    private int flush(String experimentId, List<RunRecord> unflushed, int flushedTotal, BatchProgressListener progress)
            throws IOException {
        int count = unflushed.size();
        storage.appendRuns(experimentId, unflushed);
        unflushed.clear();
        progress.onFlushed(count, flushedTotal + count);
        log.debug("Flushed {} runs of {} (total: {})", count, experimentId, flushedTotal + count);
        return count;
    }

    private static void submit(ExecutorService executor, ExperimentConfiguration config, Task task, String runId,
                               String batchId, BacktestFunction backtest, RunnerOptions options,
                               BlockingQueue<RunRecord> finished) {
        RunRecord run = new RunRecord(runId, batchId, config.getExperimentId(), task.symbol(), task.parameters());
        executor.execute(() -> execute(run, config, backtest, options, finished));
    }

    /**
     * Worker body: runs the backtest with retries. Always leaves the record terminal and
     * always hands it back.
     */
    static void execute(RunRecord run, ExperimentConfiguration config, BacktestFunction backtest,
                        RunnerOptions options, BlockingQueue<RunRecord> finished) {
        try {
            run.markRunning();
            int maxAttempts = options.maxAttempts();
            Exception lastError = null;
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                run.recordAttempt();
                try {
                    BacktestMetrics metrics = backtest.run(run.getSymbol(), config.getTimeframe(),
                        run.getParameters(), config);
                    if (metrics == null) {
                        throw new BacktestException("Backtest returned no metrics");
                    }
                    run.markCompleted(metrics);
                    return;
                } catch (Exception e) {
                    lastError = e;
                }
                if (attempt < maxAttempts) {
                    log.debug("Run {} attempt {} failed, retrying: {}", run.getRunId(), attempt, lastError.getMessage());
                    try {
                        Thread.sleep(options.retryDelay().multipliedBy(attempt).toMillis());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
            run.markFailed(lastError);
        } finally {
            if (!run.getStatus().isTerminal()) {
                run.markFailed("Unexpected termination");
            }
            finished.add(run);
        }
    }

    private static String runId(String experimentId, String batchId, int index) {
        return "%s-%s-%06d".formatted(experimentId, batchId, index);
    }

    private static ThreadFactory workerThreads(String batchId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "batch-" + batchId + "-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
