package tw.gc.auto.strategylab.services.experiment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.strategylab.enums.ExpansionMode;

/**
 * Reads and writes the declarative experiment document.
 *
 * <pre>
 * name: SMA_Optimization
 * strategy: simple_sma
 * symbols: [BTCUSDT, ETHUSDT]
 * timeframe: 1h
 * parameters:
 *   sma_short: [5, 10, 15, 20]
 *   sma_long: {start: 20, stop: 100, step: 10}
 *   risk: {start: 0.001, stop: 0.1, count: 5, log: true}
 * expansion_mode: grid
 * max_combinations: 1000
 * initial_cash: 10000
 * fee_rate: 0.0005
 * tags: [sma, trend]
 * </pre>
 *
 * <p>Writing a configuration and parsing it back always reproduces the same experiment id.
 */
@Component
@Slf4j
public class ExperimentConfigurationLoader {

    private static final Set<String> KNOWN_FIELDS = Set.of(
        "name", "strategy", "symbols", "timeframe", "parameters", "expansion_mode",
        "max_combinations", "sample_size", "combinations", "start_date", "end_date",
        "initial_cash", "fee_rate", "leverage", "stop_loss_pct", "take_profit_pct",
        "description", "tags", "created_at");

    private static final Set<String> RANGE_FIELDS = Set.of("start", "stop", "step", "count", "num", "log");

    private final ObjectMapper jsonMapper;
    private final YAMLMapper yamlMapper;

    public ExperimentConfigurationLoader(ObjectMapper jsonMapper, YAMLMapper yamlMapper) {
        this.jsonMapper = jsonMapper;
        this.yamlMapper = yamlMapper;
    }

    /**
     * Loads a configuration, choosing the parser from the file extension.
     *
     * @throws InvalidConfigurationException if the extension or content is invalid
     * @throws IOException if the file cannot be read
     */
    public ExperimentConfiguration load(Path path) throws IOException {
        DocumentFormat format = DocumentFormat.fromPath(path);
        String content = Files.readString(path);
        ExperimentConfiguration config = parse(content, format);
        log.info("📄 Loaded experiment {} from {}", config.getExperimentId(), path);
        return config;
    }

    public ExperimentConfiguration parse(String content, DocumentFormat format) throws IOException {
        JsonNode root = mapperFor(format).readTree(content);
        if (root == null || !root.isObject()) {
            throw new InvalidConfigurationException("Experiment document must be a mapping at the top level");
        }
        return fromDocument(root);
    }

    /**
     * Writes the configuration to {@code path} in the format its extension names.
     */
    public void save(ExperimentConfiguration config, Path path) throws IOException {
        DocumentFormat format = DocumentFormat.fromPath(path);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, write(config, format));
        log.debug("Saved experiment {} to {}", config.getExperimentId(), path);
    }

    public String write(ExperimentConfiguration config, DocumentFormat format) throws IOException {
        return mapperFor(format).writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(config));
    }

    public ExperimentConfiguration fromDocument(JsonNode root) {
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String field = names.next();
            if (!KNOWN_FIELDS.contains(field)) {
                throw new InvalidConfigurationException("Unknown experiment field: " + field);
            }
        }

        ExpansionMode mode = root.hasNonNull("expansion_mode")
            ? ExpansionMode.fromValue(root.get("expansion_mode").asText())
            : ExpansionMode.GRID;

        return ExperimentConfiguration.builder()
            .name(requiredText(root, "name"))
            .strategy(requiredText(root, "strategy"))
            .symbols(readSymbols(root.get("symbols")))
            .timeframe(requiredText(root, "timeframe"))
            .parameters(readParameters(root.get("parameters")))
            .expansionMode(mode)
            .maxCombinations(optionalInt(root, "max_combinations"))
            .sampleSize(optionalInt(root, "sample_size"))
            .combinations(readCombinations(root.get("combinations")))
            .startDate(optionalDate(root, "start_date"))
            .endDate(optionalDate(root, "end_date"))
            .executionDefaults(readExecution(root))
            .description(root.hasNonNull("description") ? root.get("description").asText() : null)
            .tags(readStrings(root.get("tags"), "tags"))
            .build();
    }

    public ObjectNode toDocument(ExperimentConfiguration config) {
        ObjectNode root = jsonMapper.createObjectNode();
        root.put("name", config.getName());
        root.put("strategy", config.getStrategy());
        ArrayNode symbols = root.putArray("symbols");
        config.getSymbols().forEach(symbols::add);
        root.put("timeframe", config.getTimeframe());

        ObjectNode params = root.putObject("parameters");
        config.getParameters().forEach((name, range) ->
            params.set(name, jsonMapper.valueToTree(range.toDocumentValue())));

        root.put("expansion_mode", config.getExpansionMode().value());
        if (config.getMaxCombinations() != null) {
            root.put("max_combinations", config.getMaxCombinations());
        }
        if (config.getSampleSize() != null) {
            root.put("sample_size", config.getSampleSize());
        }
        if (!config.getCombinations().isEmpty()) {
            root.set("combinations", jsonMapper.valueToTree(config.getCombinations()));
        }
        if (config.getStartDate() != null) {
            root.put("start_date", config.getStartDate().toString());
        }
        if (config.getEndDate() != null) {
            root.put("end_date", config.getEndDate().toString());
        }

        ExecutionDefaults execution = config.getExecutionDefaults();
        root.put("initial_cash", execution.initialCash());
        root.put("fee_rate", execution.feeRate());
        root.put("leverage", execution.leverage());
        if (execution.stopLossPct() != null) {
            root.put("stop_loss_pct", execution.stopLossPct());
        }
        if (execution.takeProfitPct() != null) {
            root.put("take_profit_pct", execution.takeProfitPct());
        }
        if (!config.getDescription().isEmpty()) {
            root.put("description", config.getDescription());
        }
        ArrayNode tags = root.putArray("tags");
        config.getTags().forEach(tags::add);
        return root;
    }

    private ObjectMapper mapperFor(DocumentFormat format) {
        return format == DocumentFormat.YAML ? yamlMapper : jsonMapper;
    }

    private static List<String> readSymbols(JsonNode node) {
        List<String> symbols = readStrings(node, "symbols");
        if (symbols == null) {
            throw new InvalidConfigurationException("Missing required field: symbols");
        }
        return symbols;
    }

    private static List<String> readStrings(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new InvalidConfigurationException(field + " must be a list");
        }
        List<String> values = new ArrayList<>();
        node.forEach(item -> {
            if (!item.isValueNode() || item.isNull()) {
                throw new InvalidConfigurationException(field + " must contain plain values, got: " + item);
            }
            values.add(item.asText());
        });
        return values;
    }

    private static Map<String, ParameterRange> readParameters(JsonNode node) {
        Map<String, ParameterRange> ranges = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return ranges;
        }
        if (!node.isObject()) {
            throw new InvalidConfigurationException("parameters must be a mapping of name to range");
        }
        node.fields().forEachRemaining(entry -> ranges.put(entry.getKey(), readRange(entry.getKey(), entry.getValue())));
        return ranges;
    }

    private static ParameterRange readRange(String name, JsonNode node) {
        if (node.isArray()) {
            List<Object> values = new ArrayList<>();
            node.forEach(item -> values.add(scalar(name, item)));
            return ParameterRange.ofValues(name, values);
        }
        if (!node.isObject()) {
            // a bare scalar is a single-value range
            return ParameterRange.ofValues(name, List.of(scalar(name, node)));
        }
        node.fieldNames().forEachRemaining(field -> {
            if (!RANGE_FIELDS.contains(field)) {
                throw new InvalidConfigurationException("Parameter '%s' has unknown field '%s'".formatted(name, field));
            }
        });
        if (node.has("count") && node.has("num")) {
            throw new InvalidConfigurationException("Parameter '%s' sets both count and num".formatted(name));
        }
        JsonNode countNode = node.has("count") ? node.get("count") : node.get("num");
        Integer count = null;
        if (countNode != null && !countNode.isNull()) {
            if (!countNode.canConvertToInt() || !countNode.isIntegralNumber()) {
                throw new InvalidConfigurationException("Parameter '%s' count must be an integer".formatted(name));
            }
            count = countNode.intValue();
        }
        boolean log = node.has("log") && node.get("log").asBoolean(false);
        return new ParameterRange(name, null,
            optionalNumber(name, node, "start"),
            optionalNumber(name, node, "stop"),
            optionalNumber(name, node, "step"),
            count, log);
    }

    private static Double optionalNumber(String name, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new InvalidConfigurationException("Parameter '%s' %s must be numeric, got: %s"
                .formatted(name, field, value));
        }
        return value.doubleValue();
    }

    private static Object scalar(String name, JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? (Object) node.intValue() : (Object) node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        throw new InvalidConfigurationException("Parameter '%s' has unsupported value: %s".formatted(name, node));
    }

    private static List<Map<String, Object>> readCombinations(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new InvalidConfigurationException("combinations must be a list of parameter mappings");
        }
        List<Map<String, Object>> combinations = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isObject()) {
                throw new InvalidConfigurationException("Each combination must be a mapping, got: " + item);
            }
            Map<String, Object> assignment = new LinkedHashMap<>();
            item.fields().forEachRemaining(e -> assignment.put(e.getKey(), scalar(e.getKey(), e.getValue())));
            combinations.add(assignment);
        }
        return combinations;
    }

    private static ExecutionDefaults readExecution(JsonNode root) {
        ExecutionDefaults defaults = ExecutionDefaults.defaults();
        return new ExecutionDefaults(
            optionalDouble(root, "initial_cash", defaults.initialCash()),
            optionalDouble(root, "fee_rate", defaults.feeRate()),
            optionalDouble(root, "leverage", defaults.leverage()),
            optionalDouble(root, "stop_loss_pct", null),
            optionalDouble(root, "take_profit_pct", null));
    }

    private static Double optionalDouble(JsonNode root, String field, Double fallback) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isNumber()) {
            throw new InvalidConfigurationException(field + " must be numeric, got: " + node);
        }
        return node.doubleValue();
    }

    private static Integer optionalInt(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new InvalidConfigurationException(field + " must be an integer, got: " + node);
        }
        return node.intValue();
    }

    private static LocalDate optionalDate(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return LocalDate.parse(node.asText());
        } catch (DateTimeParseException e) {
            throw new InvalidConfigurationException(field + " must be an ISO date (yyyy-MM-dd), got: " + node, e);
        }
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) {
            throw new InvalidConfigurationException("Missing required field: " + field);
        }
        return node.asText();
    }
}
