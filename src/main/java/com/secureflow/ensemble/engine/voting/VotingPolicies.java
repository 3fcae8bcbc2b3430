package com.secureflow.ensemble.engine.voting;

import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.VotingStrategy;
import com.secureflow.ensemble.model.WeightTable;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Policy lookup plus the weight arithmetic the policies share.
 */
public final class VotingPolicies {

    private static final Map<VotingStrategy, VotingPolicy> POLICIES = new EnumMap<>(VotingStrategy.class);

    static {
        register(new HardVotingPolicy());
        register(new SoftVotingPolicy());
        register(new WeightedVotingPolicy());
    }

    private VotingPolicies() {}

    private static void register(VotingPolicy policy) {
        POLICIES.put(policy.strategy(), policy);
    }

    public static VotingPolicy forStrategy(VotingStrategy strategy) {
        VotingPolicy policy = POLICIES.get(strategy);
        if (policy == null) {
            throw new IllegalArgumentException("No voting policy for " + strategy);
        }
        return policy;
    }

    /**
     * Weights of the given results scaled to sum to 1. When every weight is zero each
     * result gets the same share.
     */
    static double[] normalizedWeights(List<AlgorithmResult> results, WeightTable weights) {
        double[] raw = new double[results.size()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = weights.get(results.get(i).getDetector());
        }
        return normalize(raw);
    }

    static double[] normalize(double[] raw) {
        double total = 0.0;
        for (double w : raw) total += w;

        double[] normalized = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            normalized[i] = total > 0 ? raw[i] / total : 1.0 / raw.length;
        }
        return normalized;
    }

    /**
     * Keep a weighted mean of scores inside [min, max] of those scores despite rounding.
     */
    static double withinScoreRange(double value, List<AlgorithmResult> results) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (AlgorithmResult result : results) {
            min = Math.min(min, result.getScore());
            max = Math.max(max, result.getScore());
        }
        return Math.max(min, Math.min(max, value));
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
