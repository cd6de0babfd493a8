package com.example.solarcast.ml;

import com.example.solarcast.ArtifactFixtures;
import com.example.solarcast.config.ForecastProperties;
import com.example.solarcast.exception.ModelNotReadyException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ModelRegistry: artifact lifecycle")
class ModelRegistryTest {

    @TempDir
    Path dir;

    private ForecastProperties props;
    private ModelRegistry registry;

    @BeforeEach
    void setUp() {
        props = new ForecastProperties();
        props.getModel().setBaseDir(dir.toString());
        props.getModel().setVersion("v2");
        registry = new ModelRegistry(new ArtifactStore(dir, new ObjectMapper(), Clock.systemUTC()), props);
    }

    @Test
    void newRegistry_isEmptyAndNotReady() {
        assertThat(registry.state()).isEqualTo(ModelRegistry.State.EMPTY);
        assertThat(registry.isReady()).isFalse();
        assertThat(registry.snapshot()).isEmpty();
        assertThatThrownBy(registry::current).isInstanceOf(ModelNotReadyException.class);
    }

    @Test
    void load_success_installsPair() throws Exception {
        ArtifactFixtures.writeExampleGeneration(dir, "v2");

        assertThat(registry.load("v2")).isTrue();

        assertThat(registry.state()).isEqualTo(ModelRegistry.State.READY);
        assertThat(registry.isReady()).isTrue();
        assertThat(registry.current().version()).isEqualTo("v2");
        assertThat(registry.lastFailure()).isEmpty();
    }

    @Test
    @DisplayName("missing files leave the registry EMPTY without throwing")
    void load_missingFiles_staysEmpty() {
        assertThat(registry.load("v2")).isFalse();

        assertThat(registry.state()).isEqualTo(ModelRegistry.State.EMPTY);
        assertThat(registry.isReady()).isFalse();
        assertThat(registry.lastFailure().orElseThrow()).contains("not found");
    }

    @Test
    void startupLoad_usesConfiguredVersion() throws Exception {
        ArtifactFixtures.writeExampleGeneration(dir, "v2");

        registry.loadOnStartup();

        assertThat(registry.current().version()).isEqualTo("v2");
    }

    @Test
    void startupLoad_disabled_leavesEmpty() throws Exception {
        ArtifactFixtures.writeExampleGeneration(dir, "v2");
        props.getModel().setLoadOnStartup(false);

        registry.loadOnStartup();

        assertThat(registry.isReady()).isFalse();
    }

    @Test
    void reload_replacesPairAsAWhole() throws Exception {
        ArtifactFixtures.writeExampleGeneration(dir, "v1");
        ArtifactFixtures.writeExampleGeneration(dir, "v2");
        registry.load("v1");
        ArtifactPair first = registry.current();

        registry.load("v2");

        assertThat(registry.current()).isNotSameAs(first);
        assertThat(registry.current().version()).isEqualTo("v2");
        assertThat(first.version()).isEqualTo("v1");
    }

    @Test
    @DisplayName("a failed reload keeps the previous generation serving")
    void failedReload_keepsPreviousPair() throws Exception {
        ArtifactFixtures.writeExampleGeneration(dir, "v1");
        registry.load("v1");
        Files.writeString(dir.resolve("scaler_v3.json"), "[]");
        Files.writeString(dir.resolve("model_v3.json"), "{}");

        assertThat(registry.load("v3")).isFalse();

        assertThat(registry.state()).isEqualTo(ModelRegistry.State.READY);
        assertThat(registry.current().version()).isEqualTo("v1");
        assertThat(registry.lastFailure()).isPresent();
    }

    @Test
    void unload_dropsPairAndIsTerminal() throws Exception {
        ArtifactFixtures.writeExampleGeneration(dir, "v2");
        registry.load("v2");

        registry.unload();

        assertThat(registry.state()).isEqualTo(ModelRegistry.State.UNLOADED);
        assertThatThrownBy(registry::current).isInstanceOf(ModelNotReadyException.class);
        assertThat(registry.load("v2")).isFalse();
        assertThat(registry.isReady()).isFalse();
    }
}
