package tw.gc.auto.strategylab.services.experiment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One unit of work: a symbol paired with a concrete parameter assignment.
 */
public record Task(String symbol, Map<String, Object> parameters) {

    public Task {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Task symbol cannot be blank");
        }
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
