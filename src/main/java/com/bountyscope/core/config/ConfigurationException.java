package com.bountyscope.core.config;

/**
 * Thrown for invalid or missing configuration (scope file, rule manifest, budgets,
 * credentials). Fatal: raised before any external side effect of a run.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
