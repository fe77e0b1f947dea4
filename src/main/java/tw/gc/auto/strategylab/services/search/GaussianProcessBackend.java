package tw.gc.auto.strategylab.services.search;

import org.springframework.stereotype.Component;

/**
 * In-process Gaussian-process backend.
 */
@Component
public class GaussianProcessBackend implements SurrogateBackend {

    @Override
    public SurrogateModel fit(double[][] x, double[] y) {
        return GaussianProcessSurrogate.fit(x, y, GaussianProcessSurrogate.DEFAULT_LENGTH_SCALE,
            GaussianProcessSurrogate.DEFAULT_NOISE);
    }
}
