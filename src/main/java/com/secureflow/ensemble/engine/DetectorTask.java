package com.secureflow.ensemble.engine;

import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.FeatureVector;

import java.util.concurrent.Callable;

/**
 * One detector scoring one vector. Remembers when a pool thread picked it up, so the
 * per-detector timeout covers the detector's own work and not its time in the queue.
 */
final class DetectorTask implements Callable<AlgorithmResult> {

    private final AnomalyDetector detector;
    private final FeatureVector vector;

    private volatile boolean started;
    private volatile long startedNanos;

    DetectorTask(AnomalyDetector detector, FeatureVector vector) {
        this.detector = detector;
        this.vector = vector;
    }

    @Override
    public AlgorithmResult call() {
        startedNanos = System.nanoTime();
        started = true;
        return detector.score(vector);
    }

    DetectorType type() {
        return detector.type();
    }

    boolean isStarted() {
        return started;
    }

    /**
     * Only meaningful once {@link #isStarted()} is true.
     */
    long startedNanos() {
        return startedNanos;
    }
}
