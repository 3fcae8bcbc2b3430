package com.secureflow.ensemble.model;

import lombok.Builder;
import lombok.Value;

/**
 * One observation of a detector's quality, typically produced by an offline evaluation
 * or by the feedback tuning loop.
 */
@Value
@Builder
public class PerformanceSample {
    double accuracy;
    double precision;
    double recall;
    double f1Score;
    double falsePositiveRate;

    public static PerformanceSample fromConfusionMatrix(ConfusionMatrix matrix) {
        return PerformanceSample.builder()
                .accuracy(matrix.accuracy())
                .precision(matrix.precision())
                .recall(matrix.recall())
                .f1Score(matrix.f1Score())
                .falsePositiveRate(matrix.falsePositiveRate())
                .build();
    }

    /**
     * @throws IllegalArgumentException if any metric lies outside [0, 1]
     */
    public void validate() {
        check("accuracy", accuracy);
        check("precision", precision);
        check("recall", recall);
        check("f1Score", f1Score);
        check("falsePositiveRate", falsePositiveRate);
    }

    private static void check(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be within [0, 1] but was " + value);
        }
    }
}
