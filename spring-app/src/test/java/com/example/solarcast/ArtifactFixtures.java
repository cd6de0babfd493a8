package com.example.solarcast;

import com.example.solarcast.ml.Feature;
import com.example.solarcast.ml.FeatureRecord;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Writes small artifact generations for tests. */
public final class ArtifactFixtures {

    public static final String VERSION = "vtest";

    /** With the identity scaler, the example record predicts exactly {@link #EXAMPLE_PREDICTION}. */
    public static final double[] EXAMPLE_COEFFICIENTS = {0.0, 0.0, 0.5, 0.0, 0.0, 0.25, 0.25};
    public static final double EXAMPLE_INTERCEPT = 10.0;
    public static final double EXAMPLE_PREDICTION = 382.75;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ArtifactFixtures() {}

    public static FeatureRecord exampleRecord() {
        return new FeatureRecord(25.5, 45.0, 600.5, -0.5, -0.866, 150.0, 140.0);
    }

    public static Map<String, Object> examplePayload() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("temperature", 25.5);
        body.put("humidity", 45.0);
        body.put("ghi", 600.5);
        body.put("hour_sin", -0.5);
        body.put("hour_cos", -0.866);
        body.put("power_t_1", 150.0);
        body.put("power_t_2", 140.0);
        return body;
    }

    /** Identity scaler plus the example linear model, both tagged {@code version}. */
    public static void writeExampleGeneration(Path dir, String version) throws IOException {
        writeIdentityScaler(dir, version, Feature.values().length, true);
        writeLinearModel(dir, version, EXAMPLE_COEFFICIENTS, EXAMPLE_INTERCEPT);
    }

    public static void writeIdentityScaler(Path dir, String version, int width, boolean withNames) throws IOException {
        double[] mean = new double[width];
        double[] scale = new double[width];
        Arrays.fill(scale, 1.0);
        Map<String, Object> scaler = new LinkedHashMap<>();
        scaler.put("type", "standard");
        if (withNames) {
            scaler.put("feature_names", Feature.columns());
        }
        scaler.put("mean", mean);
        scaler.put("scale", scale);
        write(dir.resolve("scaler_" + version + ".json"), scaler);
    }

    public static void writeScaler(Path dir, String version, List<String> names, double[] mean, double[] scale)
            throws IOException {
        Map<String, Object> scaler = new LinkedHashMap<>();
        scaler.put("type", "standard");
        scaler.put("feature_names", names);
        scaler.put("mean", mean);
        scaler.put("scale", scale);
        write(dir.resolve("scaler_" + version + ".json"), scaler);
    }

    public static void writeLinearModel(Path dir, String version, double[] coefficients, double intercept)
            throws IOException {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("type", "linear");
        model.put("coefficients", coefficients);
        model.put("intercept", intercept);
        write(dir.resolve("model_" + version + ".json"), model);
    }

    /** Writes any JSON-serializable value as an artifact file. */
    public static void write(Path file, Object value) throws IOException {
        Files.createDirectories(file.getParent());
        MAPPER.writeValue(file.toFile(), value);
    }
}
