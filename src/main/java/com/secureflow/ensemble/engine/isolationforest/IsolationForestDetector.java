package com.secureflow.ensemble.engine.isolationforest;

import com.secureflow.ensemble.engine.AbstractAnomalyDetector;
import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.PerformanceProfile;

/**
 * Isolation-based detector.
 *
 * The forest isolates points by random axis-aligned splits; points that are isolated in
 * few splits are anomalous.
 *
 * Scoring:
 *   IF anomaly score ranges from 0.0 (normal) to 1.0 (anomalous).
 *   ~0.5 is uncertain. The default threshold flags scores above 0.60.
 *   Anomalous points also report the contribution of their top features.
 */
public class IsolationForestDetector extends AbstractAnomalyDetector {

    public static final double DEFAULT_THRESHOLD = 0.6;

    public static final PerformanceProfile BASELINE = PerformanceProfile.builder()
            .accuracy(0.89)
            .precision(0.87)
            .recall(0.91)
            .f1Score(0.89)
            .falsePositiveRate(0.045)
            .diversity(0.78)
            .build();

    private static final int TOP_FEATURES = 3;

    private final IsolationForest forest;

    public IsolationForestDetector(IsolationForest forest, int dimension) {
        this(forest, dimension, DEFAULT_THRESHOLD);
    }

    public IsolationForestDetector(IsolationForest forest, int dimension, double threshold) {
        super(DetectorType.ISOLATION_FOREST, dimension, threshold, BASELINE);
        this.forest = forest;
    }

    @Override
    protected AlgorithmResult.AlgorithmResultBuilder evaluate(double[] point, double threshold) {
        double averagePathLength = forest.averagePathLength(point);
        double score = forest.scoreFor(averagePathLength);
        boolean anomaly = score > threshold;

        AlgorithmResult.AlgorithmResultBuilder builder = result(score, Math.abs(score - 0.5) * 2, anomaly)
                .diagnostic("averagePathLength", averagePathLength)
                .diagnostic("expectedPathLength", forest.expectedPathLength())
                .diagnostic("trees", (double) forest.getTreeCount());

        if (anomaly) {
            // Explain which features isolate the point
            double[] contributions = forest.featureContributions(point);
            for (int idx : topN(contributions, TOP_FEATURES)) {
                if (contributions[idx] <= 0) break;
                builder.diagnostic("contribution.f" + idx, contributions[idx]);
            }
        }
        return builder;
    }

    /**
     * Indices of the n largest values, largest first; ties keep the lower index first.
     */
    static int[] topN(double[] values, int n) {
        int[] indices = new int[Math.min(n, values.length)];
        double[] topVals = new double[indices.length];
        java.util.Arrays.fill(topVals, Double.NEGATIVE_INFINITY);

        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < indices.length; j++) {
                if (values[i] > topVals[j]) {
                    for (int k = indices.length - 1; k > j; k--) {
                        indices[k] = indices[k - 1];
                        topVals[k] = topVals[k - 1];
                    }
                    indices[j] = i;
                    topVals[j] = values[i];
                    break;
                }
            }
        }
        return indices;
    }

    public IsolationForest getForest() { return forest; }
}
