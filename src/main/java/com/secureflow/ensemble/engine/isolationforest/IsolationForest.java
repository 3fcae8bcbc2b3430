package com.secureflow.ensemble.engine.isolationforest;

import java.util.Arrays;
import java.util.List;

/**
 * Trained isolation forest. Immutable; build one with {@link IsolationForestTrainer}.
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;
    private final double[] featureMeans;

    IsolationForest(List<IsolationTree> trees, int sampleSize, double[] featureMeans) {
        this.trees = List.copyOf(trees);
        this.sampleSize = sampleSize;
        this.featureMeans = featureMeans.clone();
    }

    public double averagePathLength(double[] point) {
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return total / trees.size();
    }

    /**
     * Expected path length c(sampleSize) used to normalize the score.
     */
    public double expectedPathLength() {
        return IsolationNode.averagePathLength(sampleSize);
    }

    /**
     * Compute anomaly score for a single point.
     *
     * @return score between 0.0 (normal) and 1.0 (anomalous);
     *         ~0.5 is uncertain, well below 0.5 is normal
     */
    public double anomalyScore(double[] point) {
        return scoreFor(averagePathLength(point));
    }

    /**
     * IF scoring formula: s(x, n) = 2^(-E(h(x)) / c(n)).
     */
    public double scoreFor(double averagePathLength) {
        double c = expectedPathLength();
        if (c <= 0) return 0.0;
        return Math.pow(2.0, -averagePathLength / c);
    }

    /**
     * Feature contributions: how much the score drops when each feature is replaced by its
     * training mean. Larger values mark the features that isolate the point.
     */
    public double[] featureContributions(double[] point) {
        double baseScore = anomalyScore(point);
        double[] contributions = new double[point.length];

        for (int i = 0; i < point.length; i++) {
            double[] modified = Arrays.copyOf(point, point.length);
            modified[i] = featureMeans[i];
            contributions[i] = Math.max(0, baseScore - anomalyScore(modified));
        }
        return contributions;
    }

    public int getTreeCount() { return trees.size(); }
    public int getSampleSize() { return sampleSize; }
}
