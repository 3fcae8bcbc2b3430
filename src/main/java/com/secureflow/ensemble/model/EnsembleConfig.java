package com.secureflow.ensemble.model;

import com.secureflow.ensemble.exception.ConfigurationException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable ensemble configuration. The blend coefficients are free positive scales, not a
 * probability split: weights are normalized inside each vote.
 */
@Value
@Builder(toBuilder = true)
public class EnsembleConfig {

    @Singular
    Set<DetectorType> detectors;

    @Builder.Default
    VotingStrategy votingStrategy = VotingStrategy.WEIGHTED;

    /** Fixed weights that replace the performance/diversity blend for the named detectors. */
    @Singular
    Map<DetectorType, Double> weightOverrides;

    /** Final decision threshold on the ensemble score, exclusive on both ends. */
    @Builder.Default
    double threshold = 0.6;

    @Builder.Default
    double diversityWeight = 0.3;

    @Builder.Default
    double performanceWeight = 0.7;

    /** Upper bound on a single detector's scoring time within one call. */
    @Builder.Default
    Duration detectorTimeout = Duration.ofSeconds(5);

    /**
     * All four detectors with weighted voting and the reference blend.
     */
    public static EnsembleConfig defaults() {
        return EnsembleConfig.builder()
                .detectors(Arrays.asList(DetectorType.values()))
                .build();
    }

    /**
     * @return enabled detectors in declaration order
     */
    public List<DetectorType> enabledInOrder() {
        return Arrays.stream(DetectorType.values())
                .filter(detectors::contains)
                .collect(Collectors.toList());
    }

    /**
     * @throws ConfigurationException describing the first invalid setting
     */
    public void validate() {
        if (detectors.isEmpty()) {
            throw new ConfigurationException("At least one detector must be enabled");
        }
        if (votingStrategy == null) {
            throw new ConfigurationException("Voting strategy must be set");
        }
        if (!(threshold > 0.0 && threshold < 1.0)) {
            throw new ConfigurationException("Threshold must lie strictly between 0 and 1 but was " + threshold);
        }
        if (diversityWeight < 0.0 || performanceWeight < 0.0
                || !Double.isFinite(diversityWeight) || !Double.isFinite(performanceWeight)) {
            throw new ConfigurationException(String.format(
                    "Blend coefficients must be finite and non-negative (performance=%s, diversity=%s)",
                    performanceWeight, diversityWeight));
        }
        if (diversityWeight == 0.0 && performanceWeight == 0.0) {
            throw new ConfigurationException("Performance and diversity weights cannot both be zero");
        }
        for (Map.Entry<DetectorType, Double> override : weightOverrides.entrySet()) {
            if (!detectors.contains(override.getKey())) {
                throw new ConfigurationException("Weight override for " + override.getKey().getId()
                        + " but that detector is not enabled");
            }
            Double weight = override.getValue();
            if (weight == null || weight < 0.0 || !Double.isFinite(weight)) {
                throw new ConfigurationException("Weight override for " + override.getKey().getId()
                        + " must be finite and non-negative but was " + weight);
            }
        }
        if (detectorTimeout == null || detectorTimeout.isZero() || detectorTimeout.isNegative()) {
            throw new ConfigurationException("Detector timeout must be positive but was " + detectorTimeout);
        }
    }
}
