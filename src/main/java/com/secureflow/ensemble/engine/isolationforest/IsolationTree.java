package com.secureflow.ensemble.engine.isolationforest;

import java.util.Arrays;
import java.util.Random;

public final class IsolationTree {

    private final IsolationNode root;

    public IsolationTree(IsolationNode root) {
        this.root = root;
    }

    /**
     * Recursively partition the sample: random feature, split drawn uniformly within the
     * node's observed range, until the depth limit, a single point or a constant feature.
     */
    public static IsolationTree build(double[][] sample, int maxDepth, Random random) {
        return new IsolationTree(grow(sample, 0, maxDepth, random));
    }

    private static IsolationNode grow(double[][] rows, int depth, int maxDepth, Random random) {
        if (depth >= maxDepth || rows.length <= 1) {
            return IsolationNode.externalNode(rows.length);
        }

        int feature = random.nextInt(rows[0].length);
        double low = Double.POSITIVE_INFINITY;
        double high = Double.NEGATIVE_INFINITY;
        for (double[] row : rows) {
            low = Math.min(low, row[feature]);
            high = Math.max(high, row[feature]);
        }
        if (low >= high) {
            // constant along the chosen feature
            return IsolationNode.externalNode(rows.length);
        }

        double split = low + random.nextDouble() * (high - low);
        int boundary = partition(rows, feature, split);

        IsolationNode below = grow(Arrays.copyOfRange(rows, 0, boundary), depth + 1, maxDepth, random);
        IsolationNode above = grow(Arrays.copyOfRange(rows, boundary, rows.length), depth + 1, maxDepth, random);
        return IsolationNode.internalNode(feature, split, below, above);
    }

    /**
     * Stable partition: rows with {@code row[feature] < split} first, in their original order.
     *
     * @return number of rows below the split
     */
    private static int partition(double[][] rows, int feature, double split) {
        double[][] ordered = new double[rows.length][];
        int below = 0;
        for (double[] row : rows) {
            if (row[feature] < split) ordered[below++] = row;
        }
        int next = below;
        for (double[] row : rows) {
            if (!(row[feature] < split)) ordered[next++] = row;
        }
        System.arraycopy(ordered, 0, rows, 0, rows.length);
        return below;
    }

    public double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }
}
