package com.example.solarcast.ml;

import java.util.Arrays;

/** Positional model input. Copies on the way in and out, so instances never change. */
public final class FeatureVector {

    private final double[] values;

    public FeatureVector(double[] values) {
        this.values = values.clone();
    }

    public double[] toArray() {
        return values.clone();
    }

    public double get(int index) {
        return values[index];
    }

    public int size() {
        return values.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FeatureVector other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
