package com.example.solarcast.exception;

/**
 * Scaling or regression failed on a validated vector. Points at corrupt or
 * mismatched artifacts, never at bad client input.
 */
public class InferenceFailureException extends RuntimeException {
    public InferenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
