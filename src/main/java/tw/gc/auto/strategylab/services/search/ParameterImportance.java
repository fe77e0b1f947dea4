package tw.gc.auto.strategylab.services.search;

import java.util.Map;

import tw.gc.auto.strategylab.enums.StatisticStatus;

/**
 * Share of the objective's variance each parameter explains. Importances sum to 1 unless
 * no parameter explains any variance, in which case all are 0.
 *
 * @param status SUCCESS, or INSUFFICIENT_DATA with fewer than two scored runs or a constant objective
 * @param metric Objective the importances refer to
 * @param runCount Completed runs that contributed
 * @param importances Parameter name to importance in [0, 1]
 */
public record ParameterImportance(
    StatisticStatus status,
    String metric,
    int runCount,
    Map<String, Double> importances
) {
    public ParameterImportance {
        importances = importances == null ? Map.of() : Map.copyOf(importances);
    }

    static ParameterImportance insufficient(String metric, int runCount) {
        return new ParameterImportance(StatisticStatus.INSUFFICIENT_DATA, metric, runCount, Map.of());
    }
}
