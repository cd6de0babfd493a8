package com.example.solarcast.ml;

import com.example.solarcast.ArtifactFixtures;
import com.example.solarcast.exception.ArtifactLoadException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ArtifactStore: versioned artifact loading")
class ArtifactStoreTest {

    private static final Instant NOW = Instant.parse("2026-10-19T06:00:00Z");

    @TempDir
    Path dir;

    private ArtifactStore store() {
        return new ArtifactStore(dir, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("resolves scaler_<version>.json and model_<version>.json under the base directory")
    void paths_followNamingConvention() {
        assertThat(store().scalerPath("v2")).isEqualTo(dir.resolve("scaler_v2.json"));
        assertThat(store().modelPath("v2")).isEqualTo(dir.resolve("model_v2.json"));
    }

    @Test
    void load_linearGeneration_returnsTypedPair() throws Exception {
        ArtifactFixtures.writeExampleGeneration(dir, "v2");

        ArtifactPair pair = store().load("v2");

        assertThat(pair.version()).isEqualTo("v2");
        assertThat(pair.loadedAt()).isEqualTo(NOW);
        assertThat(pair.scaler()).isInstanceOf(StandardScaler.class);
        assertThat(pair.scaler().width()).isEqualTo(7);
        assertThat(pair.regressor()).isInstanceOf(LinearRegressor.class);
        assertThat(pair.regressor().algorithm()).isEqualTo("linear");
    }

    @Test
    void load_randomForestGeneration() throws Exception {
        ArtifactFixtures.writeIdentityScaler(dir, "rf", 7, true);
        ArtifactFixtures.write(dir.resolve("model_rf.json"), Map.of(
                "type", "random_forest",
                "trees", List.of(Map.of(
                        "children_left", new int[]{1, -1, -1},
                        "children_right", new int[]{2, -1, -1},
                        "feature", new int[]{2, -2, -2},
                        "threshold", new double[]{500.0, -2.0, -2.0},
                        "value", new double[]{0.0, 120.0, 480.0}))));

        ArtifactPair pair = store().load("rf");

        assertThat(pair.regressor()).isInstanceOf(RandomForestRegressor.class);
        assertThat(pair.regressor().predict(new double[]{0, 0, 600.5, 0, 0, 0, 0})).isEqualTo(480.0);
    }

    @Test
    void load_scalerWithoutType_defaultsToStandard() throws Exception {
        ArtifactFixtures.write(dir.resolve("scaler_v1.json"), Map.of(
                "mean", new double[]{1, 2, 3, 4, 5, 6, 7},
                "scale", new double[]{1, 1, 1, 1, 1, 1, 1}));
        ArtifactFixtures.writeLinearModel(dir, "v1", new double[7], 0.0);

        assertThat(store().load("v1").scaler()).isInstanceOf(StandardScaler.class);
    }

    @Test
    void load_missingModelFile_fails() throws Exception {
        ArtifactFixtures.writeIdentityScaler(dir, "v2", 7, true);

        assertThatThrownBy(() -> store().load("v2"))
                .isInstanceOf(ArtifactLoadException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void load_relativeBaseDir_failureNamesAbsoluteDirectory() {
        var relative = new ArtifactStore(Path.of("no-such-models-dir"), new ObjectMapper(), Clock.systemUTC());

        assertThat(relative.baseDir()).isAbsolute();
        assertThatThrownBy(() -> relative.load("v2"))
                .isInstanceOf(ArtifactLoadException.class)
                .hasMessageContaining(relative.baseDir().toString());
    }

    @Test
    void load_corruptJson_fails() throws Exception {
        ArtifactFixtures.writeExampleGeneration(dir, "v2");
        Files.writeString(dir.resolve("model_v2.json"), "{ not json");

        assertThatThrownBy(() -> store().load("v2"))
                .isInstanceOf(ArtifactLoadException.class)
                .hasMessageContaining("model_v2.json");
    }

    @Test
    @DisplayName("scaler fitted on a different column order is refused")
    void load_reorderedFeatureNames_fails() throws Exception {
        ArtifactFixtures.writeScaler(dir, "v2",
                List.of("humidity", "temperature", "ghi", "hour_sin", "hour_cos", "power_t_1", "power_t_2"),
                new double[7], new double[]{1, 1, 1, 1, 1, 1, 1});
        ArtifactFixtures.writeLinearModel(dir, "v2", new double[7], 0.0);

        assertThatThrownBy(() -> store().load("v2"))
                .isInstanceOf(ArtifactLoadException.class)
                .hasMessageContaining("fitted on columns");
    }

    @Test
    void load_zeroScale_fails() throws Exception {
        ArtifactFixtures.writeScaler(dir, "v2", Feature.columns(),
                new double[7], new double[]{1, 1, 0, 1, 1, 1, 1});
        ArtifactFixtures.writeLinearModel(dir, "v2", new double[7], 0.0);

        assertThatThrownBy(() -> store().load("v2"))
                .isInstanceOf(ArtifactLoadException.class)
                .hasMessageContaining("column 2");
    }

    @Test
    void load_blankVersion_fails() {
        assertThatThrownBy(() -> store().load(" "))
                .isInstanceOf(ArtifactLoadException.class);
    }
}
