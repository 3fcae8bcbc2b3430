package com.secureflow.ensemble.exception;

/**
 * The calling thread was interrupted while waiting on detector results.
 */
public class DetectionCancelledException extends EnsembleException {

    public DetectionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
