package com.secureflow.ensemble.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Historical quality of one detector. Diversity is a fixed property of the algorithm;
 * the classification metrics follow the detector's rolling performance history.
 */
@Value
@Builder(toBuilder = true)
public class PerformanceProfile {
    double accuracy;
    double precision;
    double recall;
    double f1Score;
    double falsePositiveRate;
    double diversity;
    @With
    double weight;
}
