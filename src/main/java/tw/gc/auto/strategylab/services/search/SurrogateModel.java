package tw.gc.auto.strategylab.services.search;

/**
 * Fitted surrogate of the objective function.
 */
public interface SurrogateModel {

    Prediction predict(double[] point);

    /**
     * Predicted mean and standard deviation at a point.
     */
    record Prediction(double mean, double std) {
    }
}
