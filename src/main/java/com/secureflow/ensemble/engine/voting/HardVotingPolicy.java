package com.secureflow.ensemble.engine.voting;

import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.VotingStrategy;
import com.secureflow.ensemble.model.WeightTable;

import java.util.List;

/**
 * Weighted share of detectors that flagged the point. The score is the anomalous fraction
 * of the total weight; confidence grows as that fraction moves away from an even split.
 */
public class HardVotingPolicy implements VotingPolicy {

    @Override
    public VotingStrategy strategy() {
        return VotingStrategy.HARD;
    }

    @Override
    public VoteOutcome vote(List<AlgorithmResult> results, WeightTable weights) {
        double[] w = VotingPolicies.normalizedWeights(results, weights);
        double score = 0.0;
        for (int i = 0; i < w.length; i++) {
            if (results.get(i).isAnomaly()) {
                score += w[i];
            }
        }
        score = VotingPolicies.clamp(score);
        return new VoteOutcome(score, VotingPolicies.clamp(Math.abs(score - 0.5) * 2));
    }
}
