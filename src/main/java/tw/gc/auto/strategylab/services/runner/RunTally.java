package tw.gc.auto.strategylab.services.runner;

import java.util.OptionalDouble;

import tw.gc.auto.strategylab.enums.StatisticStatus;

/**
 * Running totals over finished runs, so a batch can report counts, the best run and
 * statistics without keeping every record in memory.
 */
final class RunTally {

    private final String rankingMetric;
    private final boolean maximize;

    private int completed;
    private int failed;
    private RunRecord bestRun;
    private double bestValue;

    private int finiteReturns;
    private double sumReturn;
    private int finiteDrawdowns;
    private double sumDrawdown;
    private int finiteSharpes;
    private double sumSharpe;
    private Double bestReturn;
    private Double worstReturn;
    private Double bestSharpe;

    RunTally(String rankingMetric, boolean maximize) {
        this.rankingMetric = rankingMetric;
        this.maximize = maximize;
    }

    void add(RunRecord run) {
        if (run.isFailed()) {
            failed++;
            return;
        }
        if (!run.isCompleted()) {
            return;
        }
        completed++;
        OptionalDouble ranking = run.metric(rankingMetric);
        if (ranking.isPresent() && (bestRun == null || isBetter(ranking.getAsDouble(), bestValue))) {
            bestRun = run;
            bestValue = ranking.getAsDouble();
        }
        BacktestMetrics m = run.getMetrics();
        if (Double.isFinite(m.totalReturn())) {
            finiteReturns++;
            sumReturn += m.totalReturn();
            bestReturn = bestReturn == null ? m.totalReturn() : Math.max(bestReturn, m.totalReturn());
            worstReturn = worstReturn == null ? m.totalReturn() : Math.min(worstReturn, m.totalReturn());
        }
        if (Double.isFinite(m.maxDrawdown())) {
            finiteDrawdowns++;
            sumDrawdown += m.maxDrawdown();
        }
        if (Double.isFinite(m.sharpeRatio())) {
            finiteSharpes++;
            sumSharpe += m.sharpeRatio();
            bestSharpe = bestSharpe == null ? m.sharpeRatio() : Math.max(bestSharpe, m.sharpeRatio());
        }
    }

    RunTally merge(RunTally other) {
        RunTally merged = new RunTally(rankingMetric, maximize);
        merged.completed = completed + other.completed;
        merged.failed = failed + other.failed;
        merged.bestRun = bestRun;
        merged.bestValue = bestValue;
        if (other.bestRun != null && (merged.bestRun == null || merged.isBetter(other.bestValue, merged.bestValue))) {
            merged.bestRun = other.bestRun;
            merged.bestValue = other.bestValue;
        }
        merged.finiteReturns = finiteReturns + other.finiteReturns;
        merged.sumReturn = sumReturn + other.sumReturn;
        merged.finiteDrawdowns = finiteDrawdowns + other.finiteDrawdowns;
        merged.sumDrawdown = sumDrawdown + other.sumDrawdown;
        merged.finiteSharpes = finiteSharpes + other.finiteSharpes;
        merged.sumSharpe = sumSharpe + other.sumSharpe;
        merged.bestReturn = max(bestReturn, other.bestReturn);
        merged.worstReturn = min(worstReturn, other.worstReturn);
        merged.bestSharpe = max(bestSharpe, other.bestSharpe);
        return merged;
    }

    int completed() {
        return completed;
    }

    int failed() {
        return failed;
    }

    RunRecord bestRun() {
        return bestRun;
    }

    String rankingMetric() {
        return rankingMetric;
    }

    boolean maximize() {
        return maximize;
    }

    ExperimentStatistics statistics(int totalRuns) {
        StatisticStatus status = completed == 0 ? StatisticStatus.INSUFFICIENT_DATA : StatisticStatus.SUCCESS;
        return new ExperimentStatistics(status, totalRuns, completed, failed,
            finiteReturns == 0 ? null : sumReturn / finiteReturns,
            finiteDrawdowns == 0 ? null : sumDrawdown / finiteDrawdowns,
            finiteSharpes == 0 ? null : sumSharpe / finiteSharpes,
            bestReturn, worstReturn, bestSharpe);
    }

    private boolean isBetter(double candidate, double current) {
        return maximize ? candidate > current : candidate < current;
    }

    private static Double max(Double a, Double b) {
        if (a == null) {
            return b;
        }
        return b == null ? a : Math.max(a, b);
    }

    private static Double min(Double a, Double b) {
        if (a == null) {
            return b;
        }
        return b == null ? a : Math.min(a, b);
    }
}
