package tw.gc.auto.strategylab.services.runner;

/**
 * Optional progress hooks for a batch. Every method defaults to a no-op so callers
 * implement only what they observe.
 */
public interface BatchProgressListener {

    BatchProgressListener NONE = new BatchProgressListener() {
    };

    default void onRunCompleted(RunRecord run, int finished, int total, int failed) {
    }

    default void onFlushed(int flushedCount, int totalFlushed) {
    }

    default void onAborted(RunRecord failedRun, int cancelledCount) {
    }
}
