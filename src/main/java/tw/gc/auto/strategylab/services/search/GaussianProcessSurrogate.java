package tw.gc.auto.strategylab.services.search;

/**
 * Gaussian-process regression with a squared-exponential kernel on the unit cube.
 *
 * <p>Targets are standardized before fitting, so the kernel's signal variance is 1.
 * The kernel matrix is factorized once with a Cholesky decomposition.
 */
public final class GaussianProcessSurrogate implements SurrogateModel {

    public static final double DEFAULT_LENGTH_SCALE = 0.25;
    public static final double DEFAULT_NOISE = 1e-6;

    private final double[][] points;
    private final double[][] cholesky;
    private final double[] alpha;
    private final double lengthScale;
    private final double yMean;
    private final double yStd;

    private GaussianProcessSurrogate(double[][] points, double[][] cholesky, double[] alpha,
                                     double lengthScale, double yMean, double yStd) {
        this.points = points;
        this.cholesky = cholesky;
        this.alpha = alpha;
        this.lengthScale = lengthScale;
        this.yMean = yMean;
        this.yStd = yStd;
    }

    /**
     * @throws IllegalArgumentException if inputs are empty or inconsistent
     * @throws IllegalStateException if the kernel matrix is not positive definite
     */
    public static GaussianProcessSurrogate fit(double[][] x, double[] y, double lengthScale, double noise) {
        int n = y.length;
        if (n == 0 || x.length != n) {
            throw new IllegalArgumentException("Need the same non-zero number of points and targets, got %d and %d"
                .formatted(x.length, n));
        }
        double mean = 0;
        for (double v : y) {
            mean += v;
        }
        mean /= n;
        double variance = 0;
        for (double v : y) {
            variance += (v - mean) * (v - mean);
        }
        double std = n > 1 ? Math.sqrt(variance / n) : 0;
        if (!(std > 1e-12)) {
            std = 1.0;
        }
        double[] standardized = new double[n];
        for (int i = 0; i < n; i++) {
            standardized[i] = (y[i] - mean) / std;
        }

        double[][] k = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j <= i; j++) {
                double value = kernel(x[i], x[j], lengthScale);
                k[i][j] = value;
                k[j][i] = value;
            }
            k[i][i] += noise;
        }
        double[][] l = decompose(k);
        double[] alpha = solveUpper(l, solveLower(l, standardized));
        return new GaussianProcessSurrogate(x, l, alpha, lengthScale, mean, std);
    }

    @Override
    public Prediction predict(double[] point) {
        int n = points.length;
        double[] kStar = new double[n];
        double mean = 0;
        for (int i = 0; i < n; i++) {
            kStar[i] = kernel(point, points[i], lengthScale);
            mean += kStar[i] * alpha[i];
        }
        double[] v = solveLower(cholesky, kStar);
        double variance = 1.0;
        for (double vi : v) {
            variance -= vi * vi;
        }
        double std = Math.sqrt(Math.max(variance, 1e-12));
        return new Prediction(mean * yStd + yMean, std * yStd);
    }

    static double kernel(double[] a, double[] b, double lengthScale) {
        double squared = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            squared += d * d;
        }
        return Math.exp(-squared / (2 * lengthScale * lengthScale));
    }

    static double[][] decompose(double[][] matrix) {
        int n = matrix.length;
        double[][] l = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j <= i; j++) {
                double sum = matrix[i][j];
                for (int k = 0; k < j; k++) {
                    sum -= l[i][k] * l[j][k];
                }
                if (i == j) {
                    if (sum <= 0 || !Double.isFinite(sum)) {
                        throw new IllegalStateException("Kernel matrix is not positive definite at row " + i);
                    }
                    l[i][i] = Math.sqrt(sum);
                } else {
                    l[i][j] = sum / l[j][j];
                }
            }
        }
        return l;
    }

    private static double[] solveLower(double[][] l, double[] b) {
        int n = b.length;
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = b[i];
            for (int k = 0; k < i; k++) {
                sum -= l[i][k] * x[k];
            }
            x[i] = sum / l[i][i];
        }
        return x;
    }

    private static double[] solveUpper(double[][] l, double[] b) {
        int n = b.length;
        double[] x = new double[n];
        for (int i = n - 1; i >= 0; i--) {
            double sum = b[i];
            for (int k = i + 1; k < n; k++) {
                sum -= l[k][i] * x[k];
            }
            x[i] = sum / l[i][i];
        }
        return x;
    }
}
