package com.example.solarcast.ml;

import com.example.solarcast.exception.ArtifactLoadException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Resolves and deserializes one artifact generation from a fixed directory:
 * {@code <baseDir>/scaler_<version>.json} and {@code <baseDir>/model_<version>.json}.
 */
@Slf4j
public class ArtifactStore {

    private final Path baseDir;
    private final ObjectMapper mapper;
    private final Clock clock;

    public ArtifactStore(Path baseDir, ObjectMapper mapper, Clock clock) {
        this.baseDir = baseDir;
        this.mapper = mapper;
        this.clock = clock;
    }

    /** Resolved against the working directory when configured relative. */
    public Path baseDir() {
        return baseDir.toAbsolutePath();
    }

    public Path scalerPath(String version) {
        return baseDir.resolve("scaler_" + version + ".json");
    }

    public Path modelPath(String version) {
        return baseDir.resolve("model_" + version + ".json");
    }

    public ArtifactPair load(String version) throws ArtifactLoadException {
        if (version == null || version.isBlank()) {
            throw new ArtifactLoadException("Model version tag is empty");
        }
        Path scalerFile = scalerPath(version);
        Path modelFile = modelPath(version);
        if (Files.notExists(scalerFile) || Files.notExists(modelFile)) {
            throw new ArtifactLoadException("Model or scaler file not found for version " + version
                    + " in " + baseDir());
        }

        FittedScaler scaler = read(scalerFile, FittedScaler.class);
        FittedRegressor regressor = read(modelFile, FittedRegressor.class);
        try {
            scaler.verify(Feature.columns());
        } catch (IllegalStateException e) {
            throw new ArtifactLoadException(scalerFile, e);
        }
        try {
            regressor.verify();
        } catch (IllegalStateException e) {
            throw new ArtifactLoadException(modelFile, e);
        }

        log.debug("Read artifacts {} and {} ({} regressor, {} scaled columns)",
                scalerFile, modelFile, regressor.algorithm(), scaler.width());
        return new ArtifactPair(scaler, regressor, version, clock.instant());
    }

    private <T> T read(Path file, Class<T> type) throws ArtifactLoadException {
        try {
            T value = mapper.readValue(file.toFile(), type);
            if (value == null) {
                throw new ArtifactLoadException("Artifact " + file + " is empty");
            }
            return value;
        } catch (ArtifactLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ArtifactLoadException(file, e);
        }
    }
}
