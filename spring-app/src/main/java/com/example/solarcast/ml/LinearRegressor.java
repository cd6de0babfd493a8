package com.example.solarcast.ml;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.linear.ArrayRealVector;

public record LinearRegressor(
        @JsonProperty("coefficients") double[] coefficients,
        @JsonProperty("intercept") double intercept) implements FittedRegressor {

    @Override
    public double predict(double[] scaled) {
        return intercept + new ArrayRealVector(coefficients, false)
                .dotProduct(new ArrayRealVector(scaled, false));
    }

    @Override
    public String algorithm() {
        return "linear";
    }

    @Override
    public void verify() {
        if (coefficients == null || coefficients.length == 0) {
            throw new IllegalStateException("linear model has no coefficients");
        }
    }
}
