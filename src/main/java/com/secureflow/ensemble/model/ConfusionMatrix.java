package com.secureflow.ensemble.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Running binary confusion matrix. Ratios whose denominator is zero are reported as 0.
 * Not thread-safe.
 */
@Getter
@ToString
public class ConfusionMatrix {

    private long truePositives;
    private long falsePositives;
    private long trueNegatives;
    private long falseNegatives;

    public void record(boolean predicted, boolean actual) {
        if (predicted && actual) truePositives++;
        else if (predicted) falsePositives++;
        else if (actual) falseNegatives++;
        else trueNegatives++;
    }

    public long total() {
        return truePositives + falsePositives + trueNegatives + falseNegatives;
    }

    public double accuracy() {
        return ratio(truePositives + trueNegatives, total());
    }

    public double precision() {
        return ratio(truePositives, truePositives + falsePositives);
    }

    public double recall() {
        return ratio(truePositives, truePositives + falseNegatives);
    }

    public double f1Score() {
        double precision = precision();
        double recall = recall();
        return (precision + recall) > 0 ? 2.0 * precision * recall / (precision + recall) : 0.0;
    }

    public double falsePositiveRate() {
        return ratio(falsePositives, falsePositives + trueNegatives);
    }

    private static double ratio(long numerator, long denominator) {
        return denominator > 0 ? (double) numerator / denominator : 0.0;
    }
}
