package tw.gc.auto.strategylab.enums;

import java.util.Locale;

import tw.gc.auto.strategylab.services.experiment.InvalidConfigurationException;

public enum SearchMode {
    GRID,
    RANDOM,
    MODEL_BASED;

    public static SearchMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException("search mode must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("BAYESIAN")) {
            return MODEL_BASED;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Unknown search mode: '%s'".formatted(value), e);
        }
    }
}
