package work.lcod.minsub.errors;

/**
 * Malformed resource or run configuration (missing project, bad disk size, unreadable config file).
 */
public final class ConfigurationException extends MinsubException {
    public ConfigurationException(String message) {
        super("invalid_configuration", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("invalid_configuration", message, cause);
    }
}
