package com.modelspec.exception;

/**
 * Exception thrown when model or variable configuration is invalid.
 * Raised at load time, or during resolution when a configured variable
 * does not fit its levels.
 */
public class ConfigurationException extends ModelSpecException {

    public ConfigurationException(String message) {
        super(Stage.CONFIGURATION, null, message);
    }

    public ConfigurationException(String subject, String message) {
        super(Stage.CONFIGURATION, subject, message);
    }

    public ConfigurationException(Stage stage, String subject, String message) {
        super(stage, subject, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(Stage.CONFIGURATION, null, message, cause);
    }
}
