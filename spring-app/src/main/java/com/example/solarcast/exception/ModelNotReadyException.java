package com.example.solarcast.exception;

/**
 * No artifact pair is installed in the registry. Recoverable by an operator
 * fixing the artifacts and restarting; callers see it as 503.
 */
public class ModelNotReadyException extends RuntimeException {
    public ModelNotReadyException() {
        super("Model registry has no artifacts loaded");
    }

    public ModelNotReadyException(String message) {
        super(message);
    }
}
