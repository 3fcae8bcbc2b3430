package com.secureflow.ensemble.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered sequence of real-valued features. Values are copied on the way in
 * and on the way out.
 */
public final class FeatureVector {

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    public static FeatureVector of(double... values) {
        Objects.requireNonNull(values, "values");
        return new FeatureVector(values.clone());
    }

    public static FeatureVector of(List<Double> values) {
        Objects.requireNonNull(values, "values");
        double[] copy = new double[values.size()];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = values.get(i);
        }
        return new FeatureVector(copy);
    }

    public int dimension() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    /**
     * @return true when every component is a finite number
     */
    public boolean isFinite() {
        for (double value : values) {
            if (!Double.isFinite(value)) return false;
        }
        return true;
    }

    public double norm() {
        double sum = 0.0;
        for (double value : values) {
            sum += value * value;
        }
        return Math.sqrt(sum);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector)) return false;
        return Arrays.equals(values, ((FeatureVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
