package com.example.solarcast.dto;

import com.example.solarcast.ml.PredictionResult;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful {@code POST /predict} body.
 *
 * <pre>{@code
 * { "predicted_power": 382.75, "unit": "Watts", "model_version": "v2" }
 * }</pre>
 */
public record PredictionResponse(
        @JsonProperty("predicted_power") double predictedPower,
        @JsonProperty("unit") String unit,
        @JsonProperty("model_version") String modelVersion) {

    public static PredictionResponse from(PredictionResult result) {
        return new PredictionResponse(result.value(), result.unit(), result.modelVersion());
    }
}
