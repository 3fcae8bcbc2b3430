package com.secureflow.ensemble.engine.isolationforest;

import com.secureflow.ensemble.engine.ModelTrainer;
import com.secureflow.ensemble.engine.TrainingData;
import com.secureflow.ensemble.model.FeatureVector;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class IsolationForestTrainer implements ModelTrainer<IsolationForest> {

    private final int numTrees;
    private final int sampleSize;
    private final long seed;

    /**
     * @param numTrees   number of trees in the forest (typically 100)
     * @param sampleSize sub-sampling size per tree (typically 256)
     * @param seed       random seed for reproducibility
     */
    public IsolationForestTrainer(int numTrees, int sampleSize, long seed) {
        if (numTrees <= 0 || sampleSize <= 0) {
            throw new IllegalArgumentException("numTrees and sampleSize must be positive");
        }
        this.numTrees = numTrees;
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    @Override
    public IsolationForest train(List<FeatureVector> reference) {
        double[][] data = TrainingData.toMatrix(reference);
        int effectiveSampleSize = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(effectiveSampleSize) / Math.log(2));

        Random random = new Random(seed);
        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            double[][] sample = TrainingData.subsample(data, effectiveSampleSize, random);
            trees.add(IsolationTree.build(sample, maxDepth, random));
        }
        return new IsolationForest(trees, effectiveSampleSize, columnMeans(data));
    }

    private static double[] columnMeans(double[][] data) {
        double[] means = new double[data[0].length];
        for (double[] row : data) {
            for (int i = 0; i < row.length; i++) {
                means[i] += row[i];
            }
        }
        for (int i = 0; i < means.length; i++) {
            means[i] /= data.length;
        }
        return means;
    }
}
