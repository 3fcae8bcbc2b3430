package com.secureflow.ensemble.reference;

import com.secureflow.ensemble.model.FeatureVector;

import java.util.List;

/**
 * Reference corpus supplied by the caller.
 */
public class InMemoryReferenceData implements ReferenceDataSource {

    private final List<FeatureVector> vectors;

    public InMemoryReferenceData(List<FeatureVector> vectors) {
        this.vectors = List.copyOf(vectors);
    }

    @Override
    public List<FeatureVector> load() {
        return vectors;
    }
}
