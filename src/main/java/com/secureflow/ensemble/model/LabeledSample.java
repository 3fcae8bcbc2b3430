package com.secureflow.ensemble.model;

import lombok.Value;

/**
 * A feature vector with its ground-truth label, used for benchmarking.
 */
@Value(staticConstructor = "of")
public class LabeledSample {
    FeatureVector vector;
    boolean anomaly;
}
