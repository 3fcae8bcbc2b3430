package com.secureflow.ensemble.engine;

import com.secureflow.ensemble.model.FeatureVector;

import java.util.List;

/**
 * Builds an immutable detector model from a reference corpus.
 *
 * @param <M> the trained model type
 */
@FunctionalInterface
public interface ModelTrainer<M> {

    /**
     * @param reference training corpus, all vectors of the same dimension
     * @throws com.secureflow.ensemble.exception.InsufficientDataException if the corpus is
     *         empty or ragged
     */
    M train(List<FeatureVector> reference);
}
