package tw.gc.auto.strategylab.services.experiment;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Serialized forms an experiment document may take, detected from the file extension.
 */
public enum DocumentFormat {
    YAML,
    JSON;

    public static DocumentFormat fromPath(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return YAML;
        }
        if (name.endsWith(".json")) {
            return JSON;
        }
        throw new InvalidConfigurationException("Unsupported experiment file format: " + path
            + " (expected .yaml, .yml or .json)");
    }
}
