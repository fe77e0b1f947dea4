package tw.gc.auto.strategylab.enums;

import java.util.Locale;

import tw.gc.auto.strategylab.services.experiment.InvalidConfigurationException;

/**
 * How an experiment's parameter ranges are turned into concrete assignments.
 */
public enum ExpansionMode {
    /** Full Cartesian product, stride-sampled when above max-combinations */
    GRID,
    /** Sampled without replacement from the full product */
    RANDOM,
    /** Literal assignments listed in the experiment document */
    LIST;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the document form ("grid", "random", "list").
     *
     * @throws InvalidConfigurationException for any other value
     */
    public static ExpansionMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException("expansion_mode must not be blank");
        }
        for (ExpansionMode mode : values()) {
            if (mode.value().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return mode;
            }
        }
        throw new InvalidConfigurationException("Unknown expansion mode: '%s' (expected grid, random or list)"
            .formatted(value));
    }
}
