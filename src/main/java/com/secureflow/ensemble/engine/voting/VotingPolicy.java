package com.secureflow.ensemble.engine.voting;

import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.VotingStrategy;
import com.secureflow.ensemble.model.WeightTable;

import java.util.List;

/**
 * Combines per-detector results into one score and confidence.
 * Implementations are pure functions of their arguments.
 */
public interface VotingPolicy {

    VotingStrategy strategy();

    /**
     * @param results non-empty results of the detectors taking part in the vote
     * @param weights raw weights for at least those detectors; normalized here
     */
    VoteOutcome vote(List<AlgorithmResult> results, WeightTable weights);
}
