package com.example.solarcast.ml;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Fitted model read from {@code model_<version>.json}. Implementations are immutable
 * and safe to call from any number of request threads.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LinearRegressor.class, name = "linear"),
        @JsonSubTypes.Type(value = RandomForestRegressor.class, name = "random_forest")
})
public interface FittedRegressor {

    /** Single-row prediction on an already scaled vector. */
    double predict(double[] scaled);

    /** Short name for logs and the model view, e.g. {@code random_forest}. */
    String algorithm();

    /** @throws IllegalStateException if the deserialized arrays are inconsistent */
    void verify();
}
