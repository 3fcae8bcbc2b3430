package com.secureflow.ensemble.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one ensemble detection call.
 */
@Value
@Builder
public class EnsembleResult {

    /** Aggregated anomaly score in [0, 1]. */
    double finalScore;

    boolean finalDecision;

    double confidence;

    /** Results of the detectors that took part in the vote, in declaration order. */
    @Singular
    List<AlgorithmResult> algorithmResults;

    /** Agreement of the boolean decisions: 1 when unanimous. */
    double consensus;

    @Singular("explanationLine")
    List<String> explanation;

    Severity severity;

    /** Weights of the detectors that took part in the vote. */
    WeightTable weights;

    VotingStrategy votingStrategy;

    /** Enabled detectors left out of the vote because they failed or timed out. */
    @Singular
    List<DetectorType> excludedDetectors;

    public long anomalyVotes() {
        return algorithmResults.stream().filter(AlgorithmResult::isAnomaly).count();
    }
}
