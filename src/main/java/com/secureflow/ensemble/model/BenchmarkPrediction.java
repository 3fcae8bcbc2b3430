package com.secureflow.ensemble.model;

import lombok.Value;

@Value
public class BenchmarkPrediction {
    boolean predicted;
    boolean actual;
    double score;
    double confidence;
}
