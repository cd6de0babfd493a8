package com.example.solarcast.ml;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.linear.ArrayRealVector;

import java.util.List;

/**
 * Exported scikit-learn {@code StandardScaler}: {@code (x - mean_) / scale_}.
 * {@code feature_names} is optional; older exports omit it.
 */
public record StandardScaler(
        @JsonProperty("feature_names") List<String> featureNames,
        @JsonProperty("mean") double[] mean,
        @JsonProperty("scale") double[] scale) implements FittedScaler {

    @Override
    public double[] transform(double[] features) {
        // DimensionMismatchException (an IllegalArgumentException) on width mismatch
        return new ArrayRealVector(features, false)
                .subtract(new ArrayRealVector(mean, false))
                .ebeDivide(new ArrayRealVector(scale, false))
                .toArray();
    }

    @Override
    public int width() {
        return mean == null ? 0 : mean.length;
    }

    @Override
    public void verify(List<String> expectedColumns) {
        if (mean == null || scale == null || mean.length == 0) {
            throw new IllegalStateException("scaler needs non-empty mean and scale");
        }
        if (mean.length != scale.length) {
            throw new IllegalStateException("scaler mean has " + mean.length
                    + " entries but scale has " + scale.length);
        }
        for (int i = 0; i < scale.length; i++) {
            if (!Double.isFinite(mean[i]) || !Double.isFinite(scale[i]) || scale[i] == 0.0) {
                throw new IllegalStateException("scaler column " + i + " has mean=" + mean[i]
                        + ", scale=" + scale[i]);
            }
        }
        if (featureNames != null && !featureNames.equals(expectedColumns)) {
            throw new IllegalStateException("scaler was fitted on columns " + featureNames
                    + " but the service sends " + expectedColumns);
        }
    }
}
