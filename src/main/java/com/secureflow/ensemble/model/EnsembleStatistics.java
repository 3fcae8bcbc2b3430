package com.secureflow.ensemble.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EnsembleStatistics {
    int totalDetectors;
    int activeDetectors;
    WeightTable weights;
    VotingStrategy votingStrategy;
    double threshold;
    /** Mean of the active detectors' profiles; its weight is the mean weight. */
    PerformanceProfile averagePerformance;
}
