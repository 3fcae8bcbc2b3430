package com.secureflow.ensemble.engine;

import com.secureflow.ensemble.exception.InsufficientDataException;
import com.secureflow.ensemble.model.FeatureVector;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Helpers shared by the model trainers.
 */
public final class TrainingData {

    private TrainingData() {}

    /**
     * Copy a reference corpus into a row matrix, rejecting empty, ragged or non-finite input.
     */
    public static double[][] toMatrix(List<FeatureVector> reference) {
        if (reference == null || reference.isEmpty()) {
            throw new InsufficientDataException("Reference corpus is empty");
        }
        int dimension = reference.get(0).dimension();
        if (dimension == 0) {
            throw new InsufficientDataException("Reference vectors have no features");
        }
        double[][] data = new double[reference.size()][];
        for (int i = 0; i < data.length; i++) {
            FeatureVector vector = reference.get(i);
            if (vector.dimension() != dimension) {
                throw new InsufficientDataException(String.format(
                        "Reference vector %d has %d features, expected %d", i, vector.dimension(), dimension));
            }
            if (!vector.isFinite()) {
                throw new InsufficientDataException("Reference vector " + i + " contains NaN or infinite values");
            }
            data[i] = vector.toArray();
        }
        return data;
    }

    /**
     * Sample {@code size} rows without replacement. When the data has no more rows than
     * requested, all rows are returned in their original order.
     */
    public static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // Fisher-Yates shuffle on indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }
}
