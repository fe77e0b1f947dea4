package tw.gc.auto.strategylab.services.experiment;

/**
 * Raised when an experiment definition cannot be accepted: invalid ranges,
 * unknown expansion modes, unsupported document formats and the like.
 * Always fatal at load time.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
