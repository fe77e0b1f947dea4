package tw.gc.auto.strategylab.services.experiment;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Builder;
import lombok.Getter;
import tw.gc.auto.strategylab.enums.ExpansionMode;

/**
 * Immutable definition of a parameter-search experiment.
 *
 * <p>The {@link #getExperimentId() experiment id} is derived from a normalized form of the
 * configuration (symbols sorted, parameters sorted, numbers canonicalized), so two equal
 * configurations always share an id and any semantic change produces a new one.
 *
 * <p>Example:
 * <pre>
 * var config = ExperimentConfiguration.builder()
 *     .name("SMA_Optimization")
 *     .strategy("simple_sma")
 *     .symbols(List.of("BTCUSDT", "ETHUSDT"))
 *     .timeframe("1h")
 *     .parameters(ExperimentConfiguration.rangesOf(
 *         ParameterRange.linear("sma_short", 5, 20, 5),
 *         ParameterRange.linear("sma_long", 20, 100, 10)))
 *     .maxCombinations(1000)
 *     .build();
 * </pre>
 */
@Getter
public final class ExperimentConfiguration {

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper();
    private static final int ID_HASH_LENGTH = 12;

    private final String name;
    private final String strategy;
    private final List<String> symbols;
    private final String timeframe;
    private final Map<String, ParameterRange> parameters;
    private final ExpansionMode expansionMode;
    private final Integer maxCombinations;
    private final Integer sampleSize;
    private final List<Map<String, Object>> combinations;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final ExecutionDefaults executionDefaults;
    private final String description;
    private final List<String> tags;
    private final String experimentId;

    @Builder(toBuilder = true)
    private ExperimentConfiguration(
            String name,
            String strategy,
            List<String> symbols,
            String timeframe,
            Map<String, ParameterRange> parameters,
            ExpansionMode expansionMode,
            Integer maxCombinations,
            Integer sampleSize,
            List<Map<String, Object>> combinations,
            LocalDate startDate,
            LocalDate endDate,
            ExecutionDefaults executionDefaults,
            String description,
            List<String> tags) {
        this.name = requireText(name, "name");
        this.strategy = requireText(strategy, "strategy");
        this.symbols = validateSymbols(symbols);
        this.timeframe = requireText(timeframe, "timeframe");
        this.parameters = validateParameters(parameters);
        this.expansionMode = expansionMode != null ? expansionMode : ExpansionMode.GRID;
        this.maxCombinations = requirePositive(maxCombinations, "max_combinations");
        this.sampleSize = requirePositive(sampleSize, "sample_size");
        this.combinations = validateCombinations(combinations, this.parameters, this.expansionMode);
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new InvalidConfigurationException("start_date (%s) must not be after end_date (%s)"
                .formatted(startDate, endDate));
        }
        this.startDate = startDate;
        this.endDate = endDate;
        this.executionDefaults = executionDefaults != null ? executionDefaults : ExecutionDefaults.defaults();
        this.description = description != null ? description : "";
        this.tags = tags != null ? List.copyOf(tags) : List.of();
        this.experimentId = deriveExperimentId();
    }

    /**
     * Keys ranges by their own names, preserving declaration order.
     */
    public static Map<String, ParameterRange> rangesOf(ParameterRange... ranges) {
        Map<String, ParameterRange> map = new LinkedHashMap<>();
        for (ParameterRange range : ranges) {
            if (map.put(range.name(), range) != null) {
                throw new InvalidConfigurationException("Duplicate parameter: " + range.name());
            }
        }
        return map;
    }

    /**
     * Copy restricted to a backtest period; walk-forward uses this for train and test slices.
     */
    public ExperimentConfiguration withPeriod(LocalDate periodStart, LocalDate periodEnd) {
        return toBuilder().startDate(periodStart).endDate(periodEnd).build();
    }

    /**
     * Copy with a different expansion mode.
     */
    public ExperimentConfiguration withExpansionMode(ExpansionMode mode) {
        return toBuilder().expansionMode(mode).build();
    }

    /**
     * Normalized form the identifier is hashed from.
     */
    public Map<String, Object> canonicalForm() {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("name", name);
        canonical.put("strategy", strategy);
        canonical.put("symbols", symbols.stream().sorted().toList());
        canonical.put("timeframe", timeframe);

        Map<String, Object> params = new TreeMap<>();
        parameters.forEach((key, range) -> params.put(key, ParameterValues.canonical(range.toDocumentValue())));
        canonical.put("parameters", params);

        canonical.put("expansion_mode", expansionMode.value());
        canonical.put("max_combinations", maxCombinations);
        canonical.put("sample_size", sampleSize);
        canonical.put("combinations", ParameterValues.canonical(combinations));
        canonical.put("start_date", startDate != null ? startDate.toString() : null);
        canonical.put("end_date", endDate != null ? endDate.toString() : null);

        Map<String, Object> execution = new TreeMap<>();
        execution.put("initial_cash", ParameterValues.canonical(executionDefaults.initialCash()));
        execution.put("fee_rate", ParameterValues.canonical(executionDefaults.feeRate()));
        execution.put("leverage", ParameterValues.canonical(executionDefaults.leverage()));
        execution.put("stop_loss_pct", ParameterValues.canonical(executionDefaults.stopLossPct()));
        execution.put("take_profit_pct", ParameterValues.canonical(executionDefaults.takeProfitPct()));
        canonical.put("execution", execution);

        canonical.put("description", description);
        canonical.put("tags", tags.stream().sorted().toList());
        return canonical;
    }

    private String deriveExperimentId() {
        try {
            String json = CANONICAL_MAPPER.writeValueAsString(canonicalForm());
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (byte b : digest) {
                hex.append(String.format("%02x", b));
            }
            return safeName(name) + "_" + hex.substring(0, ID_HASH_LENGTH);
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to derive experiment id for " + name, e);
        }
    }

    private static String safeName(String name) {
        return name.trim().replaceAll("[^A-Za-z0-9_-]", "_");
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException(field + " must not be blank");
        }
        return value;
    }

    private static Integer requirePositive(Integer value, String field) {
        if (value != null && value < 1) {
            throw new InvalidConfigurationException("%s must be >= 1, got: %d".formatted(field, value));
        }
        return value;
    }

    private static List<String> validateSymbols(List<String> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            throw new InvalidConfigurationException("symbols must contain at least one symbol");
        }
        Set<String> seen = new HashSet<>();
        for (String symbol : symbols) {
            if (symbol == null || symbol.isBlank()) {
                throw new InvalidConfigurationException("symbols must not contain blank entries");
            }
            if (!seen.add(symbol)) {
                throw new InvalidConfigurationException("Duplicate symbol: " + symbol);
            }
        }
        return List.copyOf(symbols);
    }

    private static Map<String, ParameterRange> validateParameters(Map<String, ParameterRange> parameters) {
        if (parameters == null) {
            return Map.of();
        }
        Map<String, ParameterRange> copy = new LinkedHashMap<>();
        parameters.forEach((key, range) -> {
            if (range == null) {
                throw new InvalidConfigurationException("Parameter '%s' has no range".formatted(key));
            }
            if (!range.name().equals(key)) {
                throw new InvalidConfigurationException("Parameter key '%s' does not match range name '%s'"
                    .formatted(key, range.name()));
            }
            copy.put(key, range);
        });
        return Collections.unmodifiableMap(copy);
    }

    private static List<Map<String, Object>> validateCombinations(
            List<Map<String, Object>> combinations,
            Map<String, ParameterRange> parameters,
            ExpansionMode mode) {
        if (combinations == null || combinations.isEmpty()) {
            if (mode == ExpansionMode.LIST) {
                throw new InvalidConfigurationException("expansion_mode 'list' requires a non-empty combinations list");
            }
            return List.of();
        }
        List<Map<String, Object>> copy = new ArrayList<>();
        for (Map<String, Object> combination : combinations) {
            if (combination == null) {
                throw new InvalidConfigurationException("combinations must not contain null entries");
            }
            for (var entry : combination.entrySet()) {
                if (!parameters.isEmpty() && !parameters.containsKey(entry.getKey())) {
                    throw new InvalidConfigurationException("Combination uses undeclared parameter: " + entry.getKey());
                }
                if (!ParameterValues.isSupported(entry.getValue())) {
                    throw new InvalidConfigurationException("Combination value for '%s' is unsupported: %s"
                        .formatted(entry.getKey(), entry.getValue()));
                }
            }
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(combination)));
        }
        return List.copyOf(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ExperimentConfiguration other && experimentId.equals(other.experimentId);
    }

    @Override
    public int hashCode() {
        return experimentId.hashCode();
    }

    @Override
    public String toString() {
        return "ExperimentConfiguration[%s, strategy=%s, symbols=%s, parameters=%s, mode=%s]"
            .formatted(experimentId, strategy, symbols, parameters.keySet(), expansionMode.value());
    }
}
