package com.ulio.drift.exception;

/**
 * Thrown when per-metric parameters or a loaded configuration value cannot be used.
 */
public class ConfigurationException extends DriftException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
