package com.progression.exception;

/**
 * Exception thrown when content tables or engine configuration are invalid.
 * Results in fail-fast at load time.
 */
public class ConfigurationException extends ProgressionException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
