package tw.gc.auto.strategylab.services.search;

/**
 * Expected-improvement acquisition for maximization.
 */
public final class ExpectedImprovement {

    /** Exploration margin subtracted from the improvement */
    public static final double DEFAULT_XI = 0.01;

    private ExpectedImprovement() {
    }

    public static double of(SurrogateModel.Prediction prediction, double best, double xi) {
        double improvement = prediction.mean() - best - xi;
        double sigma = prediction.std();
        if (!(sigma > 0)) {
            return Math.max(0, improvement);
        }
        double z = improvement / sigma;
        return improvement * cdf(z) + sigma * pdf(z);
    }

    static double pdf(double z) {
        return Math.exp(-0.5 * z * z) / Math.sqrt(2 * Math.PI);
    }

    static double cdf(double z) {
        return 0.5 * (1 + erf(z / Math.sqrt(2)));
    }

    // Abramowitz and Stegun 7.1.26, absolute error below 1.5e-7
    static double erf(double x) {
        double sign = Math.signum(x);
        double a = Math.abs(x);
        double t = 1 / (1 + 0.3275911 * a);
        double poly = t * (0.254829592 + t * (-0.284496736 + t * (1.421413741 + t * (-1.453152027 + t * 1.061405429))));
        return sign * (1 - poly * Math.exp(-a * a));
    }
}
