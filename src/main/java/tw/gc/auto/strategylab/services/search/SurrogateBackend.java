package tw.gc.auto.strategylab.services.search;

/**
 * Source of surrogate models for model-based search. A backend that cannot serve models
 * reports itself unavailable and the search falls back to random sampling.
 */
public interface SurrogateBackend {

    default boolean isAvailable() {
        return true;
    }

    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Fits a model to observed points.
     *
     * @param x Observed points, each coordinate in [0, 1]
     * @param y Objective values, higher is better
     */
    SurrogateModel fit(double[][] x, double[] y);
}
