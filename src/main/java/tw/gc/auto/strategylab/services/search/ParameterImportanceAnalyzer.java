package tw.gc.auto.strategylab.services.search;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.strategylab.enums.StatisticStatus;
import tw.gc.auto.strategylab.services.experiment.ParameterValues;
import tw.gc.auto.strategylab.services.runner.RunRecord;

/**
 * Variance-based parameter importance.
 *
 * <p>Completed runs are grouped by each parameter's value. A parameter whose groups have little
 * variance of the objective compared to the total variance explains much of it:
 * {@code raw = 1 - mean(within-group variance) / total variance}, clamped to [0, 1].
 * Groups of a single run carry no variance estimate and are skipped; when every group is a
 * single run the parameter alone identifies each outcome and gets raw importance 1.
 * Raw values are normalized to sum to 1.
 */
@Component
@Slf4j
public class ParameterImportanceAnalyzer {

    public ParameterImportance analyze(Collection<RunRecord> runs, String metric) {
        List<RunRecord> scored = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        Set<String> parameters = new LinkedHashSet<>();
        for (RunRecord run : runs) {
            OptionalDouble value = run.metric(metric);
            if (value.isPresent()) {
                scored.add(run);
                values.add(value.getAsDouble());
                parameters.addAll(run.getParameters().keySet());
            }
        }
        if (scored.size() < 2) {
            return ParameterImportance.insufficient(metric, scored.size());
        }
        double totalVariance = sampleVariance(values);
        if (!(totalVariance > 0)) {
            log.debug("Objective {} is constant over {} runs, importance undefined", metric, scored.size());
            return ParameterImportance.insufficient(metric, scored.size());
        }

        Map<String, Double> raw = new LinkedHashMap<>();
        for (String parameter : parameters) {
            Map<Object, List<Double>> groups = new HashMap<>();
            for (int i = 0; i < scored.size(); i++) {
                Object key = ParameterValues.canonical(scored.get(i).getParameters().get(parameter));
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(values.get(i));
            }
            double sum = 0;
            int counted = 0;
            for (List<Double> group : groups.values()) {
                if (group.size() > 1) {
                    sum += sampleVariance(group);
                    counted++;
                }
            }
            double withinVariance = counted == 0 ? 0 : sum / counted;
            raw.put(parameter, Math.max(0, Math.min(1, 1 - withinVariance / totalVariance)));
        }

        double total = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Double> normalized = new LinkedHashMap<>();
        raw.forEach((name, value) -> normalized.put(name, total > 0 ? value / total : 0.0));
        return new ParameterImportance(StatisticStatus.SUCCESS, metric, scored.size(), normalized);
    }

    static double sampleVariance(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            return 0;
        }
        double mean = 0;
        for (double v : values) {
            mean += v;
        }
        mean /= n;
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return squares / (n - 1);
    }
}
