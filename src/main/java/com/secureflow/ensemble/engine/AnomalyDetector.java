package com.secureflow.ensemble.engine;

import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.FeatureVector;
import com.secureflow.ensemble.model.PerformanceProfile;
import com.secureflow.ensemble.model.PerformanceSample;

/**
 * Interface for all ensemble detectors.
 * Each implementation owns a model trained once from the reference corpus and scores
 * feature vectors against it without mutating it.
 */
public interface AnomalyDetector {

    /**
     * The detector variant this implementation provides.
     */
    DetectorType type();

    /**
     * Score a single feature vector.
     *
     * @param vector the observation to score
     * @return the detector's result, with score and confidence within [0, 1]
     * @throws com.secureflow.ensemble.exception.DetectionException if the vector is
     *         malformed or does not match the training dimension
     */
    AlgorithmResult score(FeatureVector vector);

    PerformanceProfile performanceProfile();

    /**
     * Replace the detector's native decision threshold. Its unit depends on the detector:
     * an isolation score, a kernel decision value, a density ratio or a sparsity score.
     */
    void setThreshold(double threshold);

    double threshold();

    /**
     * Dimensionality of the reference corpus the model was trained on.
     */
    int dimension();

    /**
     * Append an observed performance sample to the rolling history and refresh the
     * classification metrics of the profile.
     */
    void recordPerformance(PerformanceSample sample);

    /**
     * Store the ensemble weight derived from the current profile.
     */
    void applyWeight(double weight);
}
