package com.example.solarcast.ml;

import java.time.Instant;

/** One model generation. Replaced wholesale on reload, never mutated. */
public record ArtifactPair(FittedScaler scaler, FittedRegressor regressor, String version, Instant loadedAt) {}
