package com.secureflow.ensemble.exception;

/**
 * Base class for every failure raised by the ensemble.
 */
public class EnsembleException extends RuntimeException {

    public EnsembleException(String message) {
        super(message);
    }

    public EnsembleException(String message, Throwable cause) {
        super(message, cause);
    }
}
