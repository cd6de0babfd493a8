package com.example.solarcast.ml;

/**
 * One range-checked request: weather, cyclical hour encoding and the two
 * lagged power readings. Only {@link com.example.solarcast.validation.FeatureValidator}
 * creates these from client input.
 */
public record FeatureRecord(
        double temperature,
        double humidity,
        double ghi,
        double hourSin,
        double hourCos,
        double powerT1,
        double powerT2) {}
