package com.secureflow.ensemble.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Output of one detector for one feature vector.
 */
@Value
@Builder
public class AlgorithmResult {

    DetectorType detector;

    /** Anomaly score in [0, 1]; higher is more anomalous. */
    double score;

    /** How far the detector is from its own decision boundary, in [0, 1]. */
    double confidence;

    boolean anomaly;

    long elapsedNanos;

    /** Detector-specific intermediate values (path lengths, ratios, neighbor counts). */
    @Singular
    Map<String, Double> diagnostics;
}
