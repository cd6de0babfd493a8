package com.example.solarcast.exception;

import java.io.IOException;
import java.nio.file.Path;

public class ArtifactLoadException extends IOException {
    public ArtifactLoadException(String message) {
        super(message);
    }

    public ArtifactLoadException(Path path, Throwable cause) {
        super("Cannot load artifact " + path + ": " + cause.getMessage(), cause);
    }
}
