package com.example.solarcast.audit;

import com.example.solarcast.ml.FeatureRecord;
import com.example.solarcast.ml.PredictionResult;

import java.time.Instant;

/** One served prediction, as written to the audit CSV. */
public record AuditRecord(
        Instant timestamp,
        double temperature,
        double humidity,
        double ghi,
        double powerT1,
        double powerT2,
        double predictedPower) {

    public static final String HEADER = "timestamp,temperature,humidity,ghi,power_t_1,power_t_2,predicted_power";

    public static AuditRecord of(Instant timestamp, FeatureRecord request, PredictionResult result) {
        return new AuditRecord(timestamp, request.temperature(), request.humidity(), request.ghi(),
                request.powerT1(), request.powerT2(), result.value());
    }

    /** Instant prints as ISO-8601 UTC; Double.toString keeps values exact. */
    public String toCsvRow() {
        return String.join(",",
                timestamp.toString(),
                Double.toString(temperature),
                Double.toString(humidity),
                Double.toString(ghi),
                Double.toString(powerT1),
                Double.toString(powerT2),
                Double.toString(predictedPower));
    }
}
