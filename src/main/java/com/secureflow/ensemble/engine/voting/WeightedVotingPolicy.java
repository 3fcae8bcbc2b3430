package com.secureflow.ensemble.engine.voting;

import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.VotingStrategy;
import com.secureflow.ensemble.model.WeightTable;

import java.util.List;

/**
 * Like soft voting, but each detector's weight is boosted by its own confidence:
 * adjusted = weight * (1 + confidence), renormalized.
 */
public class WeightedVotingPolicy implements VotingPolicy {

    @Override
    public VotingStrategy strategy() {
        return VotingStrategy.WEIGHTED;
    }

    @Override
    public VoteOutcome vote(List<AlgorithmResult> results, WeightTable weights) {
        double[] base = VotingPolicies.normalizedWeights(results, weights);
        double[] adjusted = new double[base.length];
        for (int i = 0; i < base.length; i++) {
            adjusted[i] = base[i] * (1.0 + results.get(i).getConfidence());
        }
        double[] w = VotingPolicies.normalize(adjusted);

        double score = 0.0;
        double confidence = 0.0;
        for (int i = 0; i < w.length; i++) {
            score += w[i] * results.get(i).getScore();
            confidence += w[i] * results.get(i).getConfidence();
        }
        return new VoteOutcome(VotingPolicies.withinScoreRange(score, results), VotingPolicies.clamp(confidence));
    }
}
