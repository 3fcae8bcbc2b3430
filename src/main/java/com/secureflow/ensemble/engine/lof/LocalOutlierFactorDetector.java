package com.secureflow.ensemble.engine.lof;

import com.secureflow.ensemble.engine.AbstractAnomalyDetector;
import com.secureflow.ensemble.engine.neighbors.Neighbor;
import com.secureflow.ensemble.model.AlgorithmResult;
import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.PerformanceProfile;

import java.util.List;

/**
 * Density-based detector: local outlier factor against the reference corpus.
 *
 * The ratio compares the density around the query's neighbors with the density around
 * the query itself. A ratio near 1 means the query sits in a region as dense as its
 * neighbors; the threshold (default 1.5) is in ratio units. Score = min(ratio / 3, 1).
 */
public class LocalOutlierFactorDetector extends AbstractAnomalyDetector {

    public static final double DEFAULT_THRESHOLD = 1.5;

    public static final PerformanceProfile BASELINE = PerformanceProfile.builder()
            .accuracy(0.87)
            .precision(0.85)
            .recall(0.89)
            .f1Score(0.87)
            .falsePositiveRate(0.052)
            .diversity(0.75)
            .build();

    private final LocalOutlierFactorModel model;

    public LocalOutlierFactorDetector(LocalOutlierFactorModel model, int dimension) {
        this(model, dimension, DEFAULT_THRESHOLD);
    }

    public LocalOutlierFactorDetector(LocalOutlierFactorModel model, int dimension, double threshold) {
        super(DetectorType.LOCAL_OUTLIER_FACTOR, dimension, threshold, BASELINE);
        this.model = model;
    }

    @Override
    protected AlgorithmResult.AlgorithmResultBuilder evaluate(double[] point, double threshold) {
        List<Neighbor> neighbors = model.neighbors(point);
        double lrd = model.localReachabilityDensity(neighbors);

        double neighborLrd = 0.0;
        for (Neighbor neighbor : neighbors) {
            neighborLrd += model.lrdOf(neighbor.getIndex());
        }
        double ratio = (neighborLrd / neighbors.size()) / lrd;

        return result(Math.min(ratio / 3.0, 1.0), Math.abs(ratio - 1.0), ratio > threshold)
                .diagnostic("lofRatio", ratio)
                .diagnostic("localReachabilityDensity", lrd)
                .diagnostic("neighbors", (double) neighbors.size());
    }

    public LocalOutlierFactorModel getModel() { return model; }
}
