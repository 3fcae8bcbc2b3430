package com.secureflow.ensemble.engine;

import com.secureflow.ensemble.model.DetectorType;
import com.secureflow.ensemble.model.EnsembleConfig;
import com.secureflow.ensemble.model.PerformanceProfile;
import com.secureflow.ensemble.model.WeightTable;

import java.util.EnumMap;
import java.util.Map;

/**
 * Derives detector weights from performance profiles.
 *
 * weight = performanceWeight * (accuracy + f1) / 2 + diversityWeight * diversity,
 * unless the configuration pins an explicit weight for the detector.
 */
public class WeightCalculator {

    public double weightFor(DetectorType detector, PerformanceProfile profile, EnsembleConfig config) {
        Double override = config.getWeightOverrides().get(detector);
        if (override != null) {
            return override;
        }
        double performance = (profile.getAccuracy() + profile.getF1Score()) / 2.0;
        return config.getPerformanceWeight() * performance + config.getDiversityWeight() * profile.getDiversity();
    }

    public WeightTable compute(Map<DetectorType, AnomalyDetector> detectors, EnsembleConfig config) {
        Map<DetectorType, Double> weights = new EnumMap<>(DetectorType.class);
        for (Map.Entry<DetectorType, AnomalyDetector> entry : detectors.entrySet()) {
            weights.put(entry.getKey(), weightFor(entry.getKey(), entry.getValue().performanceProfile(), config));
        }
        return WeightTable.of(weights);
    }
}
