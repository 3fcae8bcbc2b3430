package com.secureflow.ensemble.engine;

import com.secureflow.ensemble.exception.DetectionException;
import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.FeatureVector;
import com.secureflow.ensemble.model.PerformanceProfile;
import com.secureflow.ensemble.model.PerformanceSample;

/**
 * Shared plumbing for the detectors: input validation, timing, clamping and the
 * performance profile. Subclasses only implement {@link #evaluate(double[], double)}.
 */
public abstract class AbstractAnomalyDetector implements AnomalyDetector {

    private final DetectorType type;
    private final int dimension;
    private final PerformanceHistory history;

    private volatile double threshold;
    private volatile PerformanceProfile profile;

    protected AbstractAnomalyDetector(DetectorType type, int dimension, double threshold,
                                      PerformanceProfile baseline) {
        this.type = type;
        this.dimension = dimension;
        this.threshold = threshold;
        this.history = new PerformanceHistory(baseline);
        this.profile = baseline;
    }

    @Override
    public DetectorType type() {
        return type;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public final AlgorithmResult score(FeatureVector vector) {
        if (vector == null) {
            throw new DetectionException(type, "feature vector is null");
        }
        if (vector.dimension() != dimension) {
            throw new DetectionException(type, String.format(
                    "expected %d features but got %d", dimension, vector.dimension()));
        }
        if (!vector.isFinite()) {
            throw new DetectionException(type, "feature vector contains NaN or infinite values");
        }

        long start = System.nanoTime();
        AlgorithmResult.AlgorithmResultBuilder builder = evaluate(vector.toArray(), threshold);
        return builder
                .detector(type)
                .elapsedNanos(System.nanoTime() - start)
                .build();
    }

    /**
     * Score a validated point against the trained model.
     *
     * @param point     feature values, already checked for dimension and finiteness
     * @param threshold the detector's threshold at call time
     * @return a builder started with {@link #result(double, double, boolean)}
     */
    protected abstract AlgorithmResult.AlgorithmResultBuilder evaluate(double[] point, double threshold);

    /**
     * Start a result with score and confidence clamped to [0, 1].
     */
    protected AlgorithmResult.AlgorithmResultBuilder result(double score, double confidence, boolean anomaly) {
        if (Double.isNaN(score) || Double.isNaN(confidence)) {
            throw new DetectionException(type, "model produced a non-numeric score");
        }
        return AlgorithmResult.builder()
                .score(clamp(score))
                .confidence(clamp(confidence))
                .anomaly(anomaly);
    }

    public static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public PerformanceProfile performanceProfile() {
        return profile;
    }

    @Override
    public void setThreshold(double threshold) {
        if (!Double.isFinite(threshold)) {
            throw new IllegalArgumentException("threshold must be finite");
        }
        this.threshold = threshold;
    }

    @Override
    public double threshold() {
        return threshold;
    }

    @Override
    public synchronized void recordPerformance(PerformanceSample sample) {
        history.append(sample);
        profile = history.profile(profile.getWeight());
    }

    @Override
    public synchronized void applyWeight(double weight) {
        profile = history.profile(weight);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + type.getId() + ", dimension=" + dimension
                + ", threshold=" + threshold + "]";
    }
}
