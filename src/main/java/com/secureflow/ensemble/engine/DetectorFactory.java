package com.secureflow.ensemble.engine;

import com.secureflow.ensemble.model.FeatureVector;

import java.util.List;

/**
 * Trains a detector's model on the reference corpus and wraps it in a ready detector.
 */
@FunctionalInterface
public interface DetectorFactory {

    AnomalyDetector create(List<FeatureVector> reference);
}
