package com.example.solarcast.ml;

public record PredictionResult(double value, String unit, String modelVersion) {

    public static final String WATTS = "Watts";

    public static PredictionResult watts(double value, String modelVersion) {
        return new PredictionResult(value, WATTS, modelVersion);
    }
}
