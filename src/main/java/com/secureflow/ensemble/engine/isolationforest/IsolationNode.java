package com.secureflow.ensemble.engine.isolationforest;

/**
 * Node of an isolation tree. Internal nodes route on {@code point[splitFeature] < splitValue};
 * external nodes remember how many training points reached them.
 */
public final class IsolationNode {

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size;
    private final boolean external;

    private IsolationNode(int splitFeature, double splitValue, IsolationNode left, IsolationNode right,
                          int size, boolean external) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
        this.external = external;
    }

    public static IsolationNode internalNode(int splitFeature, double splitValue,
                                             IsolationNode left, IsolationNode right) {
        return new IsolationNode(splitFeature, splitValue, left, right, 0, false);
    }

    public static IsolationNode externalNode(int size) {
        return new IsolationNode(-1, Double.NaN, null, null, size, true);
    }

    public double pathLength(double[] point, int currentDepth) {
        if (external) {
            return currentDepth + averagePathLength(size);
        }
        if (point[splitFeature] < splitValue) {
            return left.pathLength(point, currentDepth + 1);
        } else {
            return right.pathLength(point, currentDepth + 1);
        }
    }

    /**
     * Average path length of unsuccessful search in a BST (Equation 1 from the IF paper).
     * c(n) = 2H(n-1) - 2(n-1)/n where H(i) = ln(i) + Euler's constant (0.5772...)
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + 0.5772156649;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }
}
