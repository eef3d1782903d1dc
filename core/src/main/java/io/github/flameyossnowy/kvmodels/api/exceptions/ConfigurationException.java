package io.github.flameyossnowy.kvmodels.api.exceptions;

/**
 * Raised once when a store connection or manager cannot be configured. Never retried.
 */
public class ConfigurationException extends ModelException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
