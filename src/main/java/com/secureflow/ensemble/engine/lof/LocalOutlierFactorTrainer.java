package com.secureflow.ensemble.engine.lof;

import com.secureflow.ensemble.engine.ModelTrainer;
import com.secureflow.ensemble.engine.TrainingData;
import com.secureflow.ensemble.engine.neighbors.KdTree;
import com.secureflow.ensemble.engine.neighbors.Neighbor;
import com.secureflow.ensemble.exception.InsufficientDataException;
import com.secureflow.ensemble.model.FeatureVector;

import java.util.List;

public class LocalOutlierFactorTrainer implements ModelTrainer<LocalOutlierFactorModel> {

    private final int k;

    /**
     * @param k neighborhood size (typically 20); capped to the corpus size minus one
     */
    public LocalOutlierFactorTrainer(int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive");
        }
        this.k = k;
    }

    @Override
    public LocalOutlierFactorModel train(List<FeatureVector> reference) {
        double[][] data = TrainingData.toMatrix(reference);
        if (data.length < 2) {
            throw new InsufficientDataException("LOF needs at least 2 reference points, got " + data.length);
        }
        int effectiveK = Math.min(k, data.length - 1);
        KdTree index = new KdTree(data);

        // Pass 1: k-distance of every reference point, excluding the point itself
        @SuppressWarnings("unchecked")
        List<Neighbor>[] neighborhoods = new List[data.length];
        double[] kDistance = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            neighborhoods[i] = index.nearest(data[i], effectiveK, i);
            kDistance[i] = neighborhoods[i].get(neighborhoods[i].size() - 1).getDistance();
        }

        // Pass 2: local reachability density
        double[] lrd = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            double reachSum = 0.0;
            for (Neighbor neighbor : neighborhoods[i]) {
                reachSum += Math.max(neighbor.getDistance(), kDistance[neighbor.getIndex()]);
            }
            lrd[i] = effectiveK / Math.max(reachSum, LocalOutlierFactorModel.MIN_REACH_SUM);
        }
        return new LocalOutlierFactorModel(index, effectiveK, kDistance, lrd);
    }
}
