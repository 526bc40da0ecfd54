package com.boundsmith.config;

/**
 * Thrown when a configuration file cannot be read or holds an invalid value.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
