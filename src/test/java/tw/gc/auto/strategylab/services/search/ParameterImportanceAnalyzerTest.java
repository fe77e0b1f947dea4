package tw.gc.auto.strategylab.services.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import tw.gc.auto.strategylab.enums.StatisticStatus;
import tw.gc.auto.strategylab.services.runner.BacktestMetrics;
import tw.gc.auto.strategylab.services.runner.RunRecord;

import static org.assertj.core.api.Assertions.*;
import static tw.gc.auto.strategylab.testutil.ExperimentTestFactory.*;

/**
 * Unit tests for {@link ParameterImportanceAnalyzer}.
 */
class ParameterImportanceAnalyzerTest {

    private final ParameterImportanceAnalyzer analyzer = new ParameterImportanceAnalyzer();

    @Test
    @DisplayName("should attribute all variance to the parameter driving the objective")
    void shouldFindDrivingParameter() {
        List<RunRecord> runs = new ArrayList<>();
        int id = 0;
        for (int a = 1; a <= 3; a++) {
            for (int b = 1; b <= 2; b++) {
                runs.add(completedRun("r" + id++, Map.of("a", a, "b", b), metrics(a, 10)));
            }
        }

        ParameterImportance importance = analyzer.analyze(runs, BacktestMetrics.SHARPE_RATIO);

        assertThat(importance.status()).isEqualTo(StatisticStatus.SUCCESS);
        assertThat(importance.runCount()).isEqualTo(6);
        assertThat(importance.importances().get("a")).isCloseTo(1.0, within(1e-9));
        assertThat(importance.importances().get("b")).isCloseTo(0.0, within(1e-9));
    }

    @Test
    @DisplayName("should normalize importances to sum to one")
    void shouldNormalize() {
        List<RunRecord> runs = new ArrayList<>();
        int id = 0;
        for (int a = 1; a <= 3; a++) {
            for (int b = 1; b <= 3; b++) {
                runs.add(completedRun("r" + id++, Map.of("a", a, "b", b), metrics(2.0 * a + b, 10)));
            }
        }

        Map<String, Double> importances = analyzer.analyze(runs, BacktestMetrics.SHARPE_RATIO).importances();

        assertThat(importances.values().stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(1.0, within(1e-9));
        assertThat(importances.get("a")).isGreaterThan(importances.get("b"));
    }

    @Test
    @DisplayName("should report insufficient data with fewer than two scored runs")
    void shouldNeedTwoRuns() {
        var runs = List.of(
            completedRun("r1", Map.of("a", 1), metrics(1.0, 10)),
            failedRun("r2", Map.of("a", 2), "boom"));

        ParameterImportance importance = analyzer.analyze(runs, BacktestMetrics.SHARPE_RATIO);

        assertThat(importance.status()).isEqualTo(StatisticStatus.INSUFFICIENT_DATA);
        assertThat(importance.runCount()).isEqualTo(1);
        assertThat(importance.importances()).isEmpty();
    }

    @Test
    @DisplayName("should report insufficient data for a constant objective")
    void shouldRejectConstantObjective() {
        var runs = List.of(
            completedRun("r1", Map.of("a", 1), metrics(1.0, 10)),
            completedRun("r2", Map.of("a", 2), metrics(1.0, 10)));

        assertThat(analyzer.analyze(runs, BacktestMetrics.SHARPE_RATIO).status())
            .isEqualTo(StatisticStatus.INSUFFICIENT_DATA);
    }

    @Test
    @DisplayName("should treat numerically equal values as one group")
    void shouldGroupEqualNumbers() {
        var runs = List.of(
            completedRun("r1", Map.of("a", 10, "b", 1), metrics(1.0, 10)),
            completedRun("r2", Map.of("a", 10.0, "b", 2), metrics(3.0, 10)),
            completedRun("r3", Map.of("a", 20, "b", 1), metrics(1.0, 10)),
            completedRun("r4", Map.of("a", 20.0, "b", 2), metrics(3.0, 10)));

        Map<String, Double> importances = analyzer.analyze(runs, BacktestMetrics.SHARPE_RATIO).importances();

        assertThat(importances.get("b")).isCloseTo(1.0, within(1e-9));
        assertThat(importances.get("a")).isCloseTo(0.0, within(1e-9));
    }
}
