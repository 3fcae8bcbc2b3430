package com.secureflow.ensemble.engine;

import com.secureflow.ensemble.model.PerformanceProfile;
import com.secureflow.ensemble.model.PerformanceSample;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded rolling window of performance samples for one detector. While the window is
 * empty the detector's baseline metrics apply; otherwise each metric is the window mean.
 */
public class PerformanceHistory {

    public static final int DEFAULT_CAPACITY = 100;

    private final PerformanceProfile baseline;
    private final int capacity;
    private final Deque<PerformanceSample> samples = new ArrayDeque<>();

    public PerformanceHistory(PerformanceProfile baseline) {
        this(baseline, DEFAULT_CAPACITY);
    }

    public PerformanceHistory(PerformanceProfile baseline, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.baseline = baseline;
        this.capacity = capacity;
    }

    public synchronized void append(PerformanceSample sample) {
        sample.validate();
        samples.addLast(sample);
        while (samples.size() > capacity) {
            samples.removeFirst();
        }
    }

    public synchronized int size() {
        return samples.size();
    }

    /**
     * @return the profile implied by the current window, carrying the given weight
     */
    public synchronized PerformanceProfile profile(double weight) {
        if (samples.isEmpty()) {
            return baseline.withWeight(weight);
        }
        double accuracy = 0, precision = 0, recall = 0, f1 = 0, fpr = 0;
        for (PerformanceSample sample : samples) {
            accuracy += sample.getAccuracy();
            precision += sample.getPrecision();
            recall += sample.getRecall();
            f1 += sample.getF1Score();
            fpr += sample.getFalsePositiveRate();
        }
        int n = samples.size();
        return PerformanceProfile.builder()
                .accuracy(accuracy / n)
                .precision(precision / n)
                .recall(recall / n)
                .f1Score(f1 / n)
                .falsePositiveRate(fpr / n)
                .diversity(baseline.getDiversity())
                .weight(weight)
                .build();
    }
}
