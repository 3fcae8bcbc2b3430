package com.secureflow.ensemble.exception;

/**
 * Invalid ensemble or detector configuration. Raised while building an orchestrator,
 * never during detection.
 */
public class ConfigurationException extends EnsembleException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
