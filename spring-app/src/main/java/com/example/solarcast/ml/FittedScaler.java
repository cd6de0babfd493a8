package com.example.solarcast.ml;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Per-feature normalization fitted during training, read from {@code scaler_<version>.json}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = StandardScaler.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = StandardScaler.class, name = "standard")
})
public interface FittedScaler {

    /**
     * @throws IllegalArgumentException if {@code features} does not have {@link #width()} entries
     */
    double[] transform(double[] features);

    int width();

    /**
     * Checks internal consistency after deserialization.
     *
     * @param expectedColumns column order the service assembles vectors in
     * @throws IllegalStateException describing the first problem found
     */
    void verify(List<String> expectedColumns);
}
