package com.secureflow.ensemble.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable detector to weight mapping, iterated in detector declaration order.
 */
@EqualsAndHashCode
@ToString
public final class WeightTable {

    private final Map<DetectorType, Double> weights;

    private WeightTable(EnumMap<DetectorType, Double> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    public static WeightTable of(Map<DetectorType, Double> weights) {
        EnumMap<DetectorType, Double> copy = new EnumMap<>(DetectorType.class);
        for (Map.Entry<DetectorType, Double> entry : weights.entrySet()) {
            double weight = entry.getValue();
            if (weight < 0.0 || !Double.isFinite(weight)) {
                throw new IllegalArgumentException("Weight for " + entry.getKey() + " must be finite and non-negative");
            }
            copy.put(entry.getKey(), weight);
        }
        return new WeightTable(copy);
    }

    public double get(DetectorType detector) {
        Double weight = weights.get(detector);
        if (weight == null) {
            throw new IllegalArgumentException("No weight for detector " + detector);
        }
        return weight;
    }

    public boolean contains(DetectorType detector) {
        return weights.containsKey(detector);
    }

    public Set<DetectorType> detectors() {
        return weights.keySet();
    }

    public Map<DetectorType, Double> asMap() {
        return weights;
    }

    public double total() {
        double total = 0.0;
        for (double weight : weights.values()) {
            total += weight;
        }
        return total;
    }

    /**
     * @return a table holding only the given detectors' weights
     */
    public WeightTable restrictTo(Collection<DetectorType> detectors) {
        EnumMap<DetectorType, Double> restricted = new EnumMap<>(DetectorType.class);
        for (DetectorType detector : detectors) {
            restricted.put(detector, get(detector));
        }
        return new WeightTable(restricted);
    }
}
