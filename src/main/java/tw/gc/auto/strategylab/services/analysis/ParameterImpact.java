package tw.gc.auto.strategylab.services.analysis;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Metric summary of the completed runs sharing one value of a parameter.
 *
 * @param std Sample standard deviation, {@code null} for a single run
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ParameterImpact(Object parameterValue, double mean, Double std, int count) {
}
