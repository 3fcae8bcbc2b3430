package com.secureflow.ensemble.engine.voting;

import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.VotingStrategy;
import com.secureflow.ensemble.model.WeightTable;

import java.util.List;

/**
 * Weighted average of scores and of confidences.
 */
public class SoftVotingPolicy implements VotingPolicy {

    @Override
    public VotingStrategy strategy() {
        return VotingStrategy.SOFT;
    }

    @Override
    public VoteOutcome vote(List<AlgorithmResult> results, WeightTable weights) {
        double[] w = VotingPolicies.normalizedWeights(results, weights);
        double score = 0.0;
        double confidence = 0.0;
        for (int i = 0; i < w.length; i++) {
            score += w[i] * results.get(i).getScore();
            confidence += w[i] * results.get(i).getConfidence();
        }
        return new VoteOutcome(VotingPolicies.withinScoreRange(score, results), VotingPolicies.clamp(confidence));
    }
}
