package com.pgwire.configuration.exception;

/**
 * Thrown when connection settings cannot be read from the configured sources.
 */
public class ConfigurationInitializationException extends RuntimeException {
    public ConfigurationInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
