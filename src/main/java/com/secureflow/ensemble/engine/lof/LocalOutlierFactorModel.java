package com.secureflow.ensemble.engine.lof;

import com.secureflow.ensemble.engine.neighbors.KdTree;
import com.secureflow.ensemble.engine.neighbors.Neighbor;

import java.util.List;

/**
 * Reference corpus indexed for LOF scoring, with the k-distance and local reachability
 * density of every reference point precomputed.
 */
public final class LocalOutlierFactorModel {

    static final double MIN_REACH_SUM = 1e-10;

    private final KdTree index;
    private final int k;
    private final double[] kDistance;
    private final double[] lrd;

    LocalOutlierFactorModel(KdTree index, int k, double[] kDistance, double[] lrd) {
        this.index = index;
        this.k = k;
        this.kDistance = kDistance;
        this.lrd = lrd;
    }

    /**
     * k nearest reference points of an arbitrary query.
     */
    public List<Neighbor> neighbors(double[] point) {
        return index.nearest(point, k, -1);
    }

    /**
     * reach(p, o) = max(dist(p, o), kDistance(o)).
     */
    public double reachDistance(Neighbor neighbor) {
        return Math.max(neighbor.getDistance(), kDistance[neighbor.getIndex()]);
    }

    /**
     * LRD of a query from its neighbors: k / sum of reach distances.
     */
    public double localReachabilityDensity(List<Neighbor> neighbors) {
        double reachSum = 0.0;
        for (Neighbor neighbor : neighbors) {
            reachSum += reachDistance(neighbor);
        }
        return neighbors.size() / Math.max(reachSum, MIN_REACH_SUM);
    }

    public double lrdOf(int referenceIndex) {
        return lrd[referenceIndex];
    }

    public int getK() { return k; }
    public int getReferenceSize() { return index.size(); }
}
