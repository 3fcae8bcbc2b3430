package com.secureflow.ensemble.engine;

import com.secureflow.ensemble.engine.voting.VoteOutcome;
import com.secureflow.ensemble.engine.voting.VotingPolicies;
import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.EnsembleResult;
import com.secureflow.ensemble.model.Severity;
import com.secureflow.ensemble.model.VotingStrategy;
import com.secureflow.ensemble.model.WeightTable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns the surviving detector results of one call into an {@link EnsembleResult}:
 * vote, consensus, severity and explanation.
 */
public class EnsembleAggregator {

    private static final int TOP_DETECTORS = 2;

    /**
     * @param results   surviving results in detector declaration order, non-empty
     * @param weights   weights of exactly the surviving detectors
     * @param excluded  enabled detectors that failed or timed out
     */
    public EnsembleResult aggregate(List<AlgorithmResult> results, WeightTable weights,
                                    VotingStrategy strategy, double threshold,
                                    List<DetectorType> excluded) {
        if (results.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty result set");
        }

        double finalScore;
        double confidence;
        boolean decision;
        if (results.size() == 1) {
            // A lone detector speaks for itself
            AlgorithmResult only = results.get(0);
            finalScore = only.getScore();
            confidence = only.getConfidence();
            decision = only.isAnomaly();
        } else {
            VoteOutcome outcome = VotingPolicies.forStrategy(strategy).vote(results, weights);
            finalScore = outcome.getScore();
            confidence = outcome.getConfidence();
            decision = finalScore > threshold;
        }

        return EnsembleResult.builder()
                .finalScore(finalScore)
                .finalDecision(decision)
                .confidence(confidence)
                .algorithmResults(results)
                .consensus(consensus(results))
                .explanation(explain(results, strategy, finalScore, threshold, excluded))
                .severity(Severity.fromScore(finalScore))
                .weights(weights)
                .votingStrategy(strategy)
                .excludedDetectors(excluded)
                .build();
    }

    /**
     * 1 - population standard deviation of the boolean decisions.
     */
    public static double consensus(List<AlgorithmResult> results) {
        double mean = 0.0;
        for (AlgorithmResult result : results) {
            mean += result.isAnomaly() ? 1.0 : 0.0;
        }
        mean /= results.size();

        double variance = 0.0;
        for (AlgorithmResult result : results) {
            double diff = (result.isAnomaly() ? 1.0 : 0.0) - mean;
            variance += diff * diff;
        }
        variance /= results.size();
        return 1.0 - Math.sqrt(variance);
    }

    private List<String> explain(List<AlgorithmResult> results, VotingStrategy strategy,
                                 double finalScore, double threshold, List<DetectorType> excluded) {
        List<String> lines = new ArrayList<>();
        lines.add(String.format("%s voting: final score %.3f (threshold %.2f)",
                strategy.label(), finalScore, threshold));

        long flagged = results.stream().filter(AlgorithmResult::isAnomaly).count();
        lines.add(String.format("%d/%d detectors flagged anomaly", flagged, results.size()));

        // stable sort keeps declaration order among equal scores
        List<AlgorithmResult> ranked = new ArrayList<>(results);
        ranked.sort(Comparator.comparingDouble(AlgorithmResult::getScore).reversed());
        lines.add("Top detectors: " + ranked.stream()
                .limit(TOP_DETECTORS)
                .map(r -> String.format("%s=%.3f", r.getDetector().getId(), r.getScore()))
                .collect(Collectors.joining(", ")));

        if (!excluded.isEmpty()) {
            lines.add("Excluded after failure or timeout: " + excluded.stream()
                    .map(DetectorType::getId)
                    .collect(Collectors.joining(", ")));
        }
        return lines;
    }
}
