package com.secureflow.ensemble.exception;

/**
 * Raised when an operation is given no data to work on, e.g. a benchmark over an empty
 * dataset or training over an empty reference corpus.
 */
public class InsufficientDataException extends EnsembleException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
