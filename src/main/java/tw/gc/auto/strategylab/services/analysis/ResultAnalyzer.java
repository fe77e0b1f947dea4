package tw.gc.auto.strategylab.services.analysis;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.strategylab.services.experiment.ParameterValues;
import tw.gc.auto.strategylab.services.runner.ExperimentResult;
import tw.gc.auto.strategylab.services.runner.RunRecord;
import tw.gc.auto.strategylab.services.search.ParameterImportanceAnalyzer;
import tw.gc.auto.strategylab.services.storage.ExperimentStorage;

/**
 * Ranks, correlates and summarizes the completed runs of an experiment.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResultAnalyzer {

    public static final int DEFAULT_TOP_N = 10;

    private final ParameterImportanceAnalyzer importanceAnalyzer;
    private final ExperimentStorage storage;

    public AnalysisReport analyze(ExperimentResult result) throws IOException {
        return analyze(result, DEFAULT_TOP_N, result.getRankingMetric(), result.isMaximize());
    }

    /**
     * Builds the report. Runs flushed out of memory are read back from the run log.
     *
     * @throws IOException if the run log cannot be read
     */
    public AnalysisReport analyze(ExperimentResult result, int topN, String metric, boolean maximize)
            throws IOException {
        List<RunRecord> runs = runsOf(result);
        log.info("📊 Analyzing {} runs of {} by {}", runs.size(), result.getExperimentId(), metric);

        List<RunRecord> top = topRuns(runs, topN, metric, maximize);
        RunRecord best = top.isEmpty() ? null : top.get(0);
        return new AnalysisReport(
            result.getExperimentId(),
            result.getConfiguration().getName(),
            metric,
            maximize,
            result.getCompletedRuns() + result.getFailedRuns(),
            result.getCompletedRuns(),
            result.getFailedRuns(),
            best,
            best != null ? best.getParameters() : null,
            top,
            result.statistics(),
            importanceAnalyzer.analyze(runs, metric),
            correlations(runs, metric),
            Instant.now()
        );
    }

    /**
     * Completed runs with a finite {@code metric}, best first.
     */
    public List<RunRecord> topRuns(List<RunRecord> runs, int topN, String metric, boolean maximize) {
        Comparator<RunRecord> byMetric = Comparator.comparingDouble(r -> r.metric(metric).getAsDouble());
        return runs.stream()
            .filter(r -> r.metric(metric).isPresent())
            .sorted(maximize ? byMetric.reversed() : byMetric)
            .limit(Math.max(0, topN))
            .toList();
    }

    /**
     * Pearson correlation of every numeric parameter with {@code metric} over completed runs.
     */
    public Map<String, Double> correlations(List<RunRecord> runs, String metric) {
        Set<String> parameters = new LinkedHashSet<>();
        runs.forEach(r -> parameters.addAll(r.getParameters().keySet()));

        Map<String, Double> correlations = new LinkedHashMap<>();
        for (String parameter : parameters) {
            List<double[]> pairs = new ArrayList<>();
            for (RunRecord run : runs) {
                OptionalDouble y = run.metric(metric);
                OptionalDouble x = ParameterValues.asDouble(run.getParameters().get(parameter));
                if (x.isPresent() && y.isPresent()) {
                    pairs.add(new double[] {x.getAsDouble(), y.getAsDouble()});
                }
            }
            OptionalDouble r = pearson(pairs);
            r.ifPresent(value -> correlations.put(parameter, value));
        }
        return correlations;
    }

    /**
     * Groups completed runs by the value of one parameter.
     */
    public List<ParameterImpact> parameterImpact(List<RunRecord> runs, String parameter, String metric) {
        Map<Object, List<Double>> groups = new LinkedHashMap<>();
        Map<Object, Object> representatives = new LinkedHashMap<>();
        for (RunRecord run : runs) {
            OptionalDouble value = run.metric(metric);
            if (value.isEmpty() || !run.getParameters().containsKey(parameter)) {
                continue;
            }
            Object raw = run.getParameters().get(parameter);
            Object key = ParameterValues.canonical(raw);
            representatives.putIfAbsent(key, raw);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(value.getAsDouble());
        }
        List<ParameterImpact> impacts = new ArrayList<>();
        groups.forEach((key, values) -> {
            double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
            Double std = null;
            if (values.size() > 1) {
                double sumSq = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum();
                std = Math.sqrt(sumSq / (values.size() - 1));
            }
            impacts.add(new ParameterImpact(representatives.get(key), mean, std, values.size()));
        });
        return impacts;
    }

    static OptionalDouble pearson(List<double[]> pairs) {
        int n = pairs.size();
        if (n < 2) {
            return OptionalDouble.empty();
        }
        double meanX = pairs.stream().mapToDouble(p -> p[0]).average().orElse(0);
        double meanY = pairs.stream().mapToDouble(p -> p[1]).average().orElse(0);
        double sxy = 0;
        double sxx = 0;
        double syy = 0;
        for (double[] p : pairs) {
            sxy += (p[0] - meanX) * (p[1] - meanY);
            sxx += (p[0] - meanX) * (p[0] - meanX);
            syy += (p[1] - meanY) * (p[1] - meanY);
        }
        if (sxx == 0 || syy == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(sxy / Math.sqrt(sxx * syy));
    }

    private List<RunRecord> runsOf(ExperimentResult result) throws IOException {
        if (result.isRunsRetained() || storage == null) {
            return result.getRuns();
        }
        return storage.runsOf(result);
    }
}
