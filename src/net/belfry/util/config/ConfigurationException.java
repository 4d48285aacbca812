package net.belfry.util.config;

/**
 * Raised when configuration cannot be loaded or a value is malformed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

}
