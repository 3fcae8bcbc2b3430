package com.secureflow.ensemble.reference;

import com.secureflow.ensemble.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Synthetic reference corpus: a single Gaussian cluster at the origin with
 * sigma = radius / 3, keeping only points within the radius.
 * The same seed always yields the same corpus.
 */
public class GaussianClusterReferenceData implements ReferenceDataSource {

    private static final Logger log = LoggerFactory.getLogger(GaussianClusterReferenceData.class);

    private final long seed;
    private final int dimension;
    private final int size;
    private final double radius;

    public GaussianClusterReferenceData(long seed, int dimension, int size, double radius) {
        if (dimension <= 0 || size <= 0) {
            throw new IllegalArgumentException("dimension and size must be positive");
        }
        if (!(radius > 0) || Double.isInfinite(radius)) {
            throw new IllegalArgumentException("radius must be positive and finite");
        }
        this.seed = seed;
        this.dimension = dimension;
        this.size = size;
        this.radius = radius;
    }

    @Override
    public List<FeatureVector> load() {
        Random random = new Random(seed); // fixed seed for reproducibility
        double sigma = radius / 3.0;
        List<FeatureVector> points = new ArrayList<>(size);
        int rejected = 0;

        while (points.size() < size) {
            double[] values = new double[dimension];
            double squaredNorm = 0.0;
            for (int i = 0; i < dimension; i++) {
                values[i] = random.nextGaussian() * sigma;
                squaredNorm += values[i] * values[i];
            }
            if (squaredNorm <= radius * radius) {
                points.add(FeatureVector.of(values));
            } else {
                rejected++;
            }
        }

        log.info("Generated {} reference vectors (dimension={}, radius={}, rejected={})",
                size, dimension, radius, rejected);
        return Collections.unmodifiableList(points);
    }
}
