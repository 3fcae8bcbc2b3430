package com.secureflow.ensemble.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Confusion-matrix metrics of one benchmark run. Samples that no detector could score are
 * counted in {@code failedSamples} and left out of the metrics. When the run was cancelled
 * or timed out {@code complete} is false and the metrics cover only the samples reached.
 */
@Value
@Builder
public class BenchmarkReport {
    double accuracy;
    double precision;
    double recall;
    double f1Score;
    double falsePositiveRate;
    int totalSamples;
    int evaluatedSamples;
    int failedSamples;
    long truePositives;
    long falsePositives;
    long trueNegatives;
    long falseNegatives;
    @Singular
    List<BenchmarkPrediction> predictions;
    boolean complete;
}
