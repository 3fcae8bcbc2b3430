package com.secureflow.ensemble.engine;

import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.EnsembleConfig;
import com.secureflow.ensemble.model.WeightTable;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable snapshot read once per detection call: configuration, the enabled detectors
 * in declaration order and their current weights.
 */
@Value
class EnsembleState {
    EnsembleConfig config;
    Map<DetectorType, AnomalyDetector> detectors;
    WeightTable weights;

    static EnsembleState of(EnsembleConfig config, Map<DetectorType, AnomalyDetector> detectors, WeightTable weights) {
        return new EnsembleState(config, Collections.unmodifiableMap(new EnumMap<>(detectors)), weights);
    }
}
