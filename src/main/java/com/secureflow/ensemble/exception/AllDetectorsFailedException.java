package com.secureflow.ensemble.exception;

import java.util.List;

/**
 * Every enabled detector failed on the same input, so no ensemble result can be produced.
 * The individual failures are attached as suppressed exceptions.
 */
public class AllDetectorsFailedException extends EnsembleException {

    private final List<DetectionException> failures;

    public AllDetectorsFailedException(List<DetectionException> failures) {
        super("All " + failures.size() + " enabled detectors failed");
        this.failures = List.copyOf(failures);
        failures.forEach(this::addSuppressed);
    }

    public List<DetectionException> getFailures() {
        return failures;
    }
}
