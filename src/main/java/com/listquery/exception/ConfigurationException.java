package com.listquery.exception;

/**
 * Exception thrown when the resource catalog is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends ListQueryException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
