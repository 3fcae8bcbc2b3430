package com.secureflow.ensemble.engine.clustering;

import com.secureflow.ensemble.engine.AbstractAnomalyDetector;
import com.secureflow.ensemble.engine.neighbors.KdTree;
import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.PerformanceProfile;

/**
 * Clustering-based detector using the DBSCAN core-point criterion: a query with fewer
 * than minPts reference points within eps is noise.
 *
 * score = 1 - min(count / minPts, 1); with the default threshold of 0 any point short of
 * a full neighborhood is flagged.
 */
public class DensityNeighborhoodDetector extends AbstractAnomalyDetector {

    public static final double DEFAULT_THRESHOLD = 0.0;
    public static final double DEFAULT_EPS = 0.5;
    public static final int DEFAULT_MIN_POINTS = 5;

    public static final PerformanceProfile BASELINE = PerformanceProfile.builder()
            .accuracy(0.84)
            .precision(0.82)
            .recall(0.86)
            .f1Score(0.84)
            .falsePositiveRate(0.068)
            .diversity(0.88)
            .build();

    private final KdTree index;
    private final double eps;
    private final int minPoints;

    public DensityNeighborhoodDetector(KdTree index, int dimension, double eps, int minPoints) {
        this(index, dimension, eps, minPoints, DEFAULT_THRESHOLD);
    }

    public DensityNeighborhoodDetector(KdTree index, int dimension, double eps, int minPoints, double threshold) {
        super(DetectorType.DENSITY_NEIGHBORHOOD, dimension, threshold, BASELINE);
        if (!(eps > 0) || minPoints <= 0) {
            throw new IllegalArgumentException("eps and minPoints must be positive");
        }
        this.index = index;
        this.eps = eps;
        this.minPoints = minPoints;
    }

    @Override
    protected AlgorithmResult.AlgorithmResultBuilder evaluate(double[] point, double threshold) {
        int count = index.countWithin(point, eps);
        double score = 1.0 - Math.min((double) count / minPoints, 1.0);

        return result(score, Math.abs(score - 0.5) * 2, score > threshold)
                .diagnostic("neighborsWithinEps", (double) count)
                .diagnostic("eps", eps)
                .diagnostic("minPoints", (double) minPoints);
    }
}
