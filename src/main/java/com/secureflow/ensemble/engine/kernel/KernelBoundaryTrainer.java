package com.secureflow.ensemble.engine.kernel;

import com.secureflow.ensemble.engine.ModelTrainer;
import com.secureflow.ensemble.engine.TrainingData;
import com.secureflow.ensemble.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Fits a one-class RBF boundary around the reference corpus.
 *
 * Support points are a seeded subsample of the corpus, each with coefficient 1/m.
 * The bias is the nu-quantile of the kernel sums over the corpus, so roughly a
 * fraction nu of the reference points falls outside the boundary.
 */
public class KernelBoundaryTrainer implements ModelTrainer<KernelBoundaryModel> {

    private static final Logger log = LoggerFactory.getLogger(KernelBoundaryTrainer.class);

    private final int maxSupportVectors;
    private final double nu;
    private final double gamma;
    private final long seed;

    /**
     * @param maxSupportVectors upper bound on the number of support points (typically 200)
     * @param nu                expected outlier fraction of the corpus, in (0, 1)
     * @param gamma             RBF width; zero or negative derives it from the corpus variance
     * @param seed              random seed for the support point subsample
     */
    public KernelBoundaryTrainer(int maxSupportVectors, double nu, double gamma, long seed) {
        if (maxSupportVectors <= 0) {
            throw new IllegalArgumentException("maxSupportVectors must be positive");
        }
        if (!(nu > 0 && nu < 1)) {
            throw new IllegalArgumentException("nu must be within (0, 1)");
        }
        this.maxSupportVectors = maxSupportVectors;
        this.nu = nu;
        this.gamma = gamma;
        this.seed = seed;
    }

    @Override
    public KernelBoundaryModel train(List<FeatureVector> reference) {
        double[][] data = TrainingData.toMatrix(reference);
        double[][] supportVectors = TrainingData.subsample(
                data, Math.min(maxSupportVectors, data.length), new Random(seed));

        double effectiveGamma = gamma > 0 ? gamma : autoGamma(data);
        KernelBoundaryModel unbiased = new KernelBoundaryModel(supportVectors, effectiveGamma, 0.0);

        double[] sums = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            sums[i] = unbiased.kernelSum(data[i]);
        }
        Arrays.sort(sums);
        int index = Math.min((int) Math.floor(nu * data.length), data.length - 1);
        // rho is a divisor when scoring
        double rho = Math.max(sums[index], Double.MIN_NORMAL);

        log.debug("Kernel boundary trained: supportVectors={}, gamma={}, rho={}",
                supportVectors.length, effectiveGamma, rho);
        return new KernelBoundaryModel(supportVectors, effectiveGamma, rho);
    }

    /**
     * gamma = 1 / (dimension * variance) with the variance pooled over every coordinate.
     */
    static double autoGamma(double[][] data) {
        int dimension = data[0].length;
        double count = (double) data.length * dimension;
        double mean = 0.0;
        for (double[] row : data) {
            for (double value : row) mean += value;
        }
        mean /= count;
        double variance = 0.0;
        for (double[] row : data) {
            for (double value : row) variance += (value - mean) * (value - mean);
        }
        variance /= count;
        return variance > 0 ? 1.0 / (dimension * variance) : 1.0;
    }
}
