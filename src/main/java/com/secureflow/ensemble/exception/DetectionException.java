package com.secureflow.ensemble.exception;

import com.secureflow.ensemble.model.DetectorType;

/**
 * A single detector failed to score a single feature vector. The orchestrator recovers
 * from it by leaving the detector out of that call's vote.
 */
public class DetectionException extends EnsembleException {

    private final DetectorType detector;

    public DetectionException(DetectorType detector, String message) {
        super(detector.getId() + ": " + message);
        this.detector = detector;
    }

    public DetectionException(DetectorType detector, String message, Throwable cause) {
        super(detector.getId() + ": " + message, cause);
        this.detector = detector;
    }

    public DetectorType getDetector() {
        return detector;
    }
}
