package com.secureflow.ensemble.reference;

import com.secureflow.ensemble.model.FeatureVector;

import java.util.List;

/**
 * Supplies the corpus of known-normal feature vectors the detectors are trained on.
 */
public interface ReferenceDataSource {

    List<FeatureVector> load();
}
