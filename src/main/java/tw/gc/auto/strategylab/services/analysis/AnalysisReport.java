package tw.gc.auto.strategylab.services.analysis;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import tw.gc.auto.strategylab.services.runner.ExperimentStatistics;
import tw.gc.auto.strategylab.services.runner.RunRecord;
import tw.gc.auto.strategylab.services.search.ParameterImportance;

/**
 * Structured analysis of one experiment result.
 *
 * @param bestRun Best completed run by {@code metric}, {@code null} when none completed
 * @param topRuns Up to N completed runs, best first
 * @param parameterCorrelations Pearson correlation of each numeric parameter with {@code metric};
 *                              parameters without variation are left out
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalysisReport(
    String experimentId,
    String experimentName,
    String metric,
    boolean maximize,
    int totalRuns,
    int completedRuns,
    int failedRuns,
    RunRecord bestRun,
    Map<String, Object> bestParameters,
    List<RunRecord> topRuns,
    ExperimentStatistics statistics,
    ParameterImportance parameterImportance,
    Map<String, Double> parameterCorrelations,
    Instant generatedAt
) {
}
