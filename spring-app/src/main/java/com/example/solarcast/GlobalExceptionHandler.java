package com.example.solarcast;

import com.example.solarcast.exception.InferenceFailureException;
import com.example.solarcast.exception.ModelNotReadyException;
import com.example.solarcast.validation.FeatureValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * The only place failure kinds become HTTP statuses. Inference and unexpected errors
 * answer with an opaque detail; the cause stays in the server log.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String MODEL_NOT_LOADED = "ML Model is not loaded available";
    static final String INTERNAL_ERROR = "Internal processing error";

    @ExceptionHandler(FeatureValidationException.class)
    public ResponseEntity<Map<String, Object>> invalidInput(FeatureValidationException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("detail", ex.getViolations()));
    }

    @ExceptionHandler(ModelNotReadyException.class)
    public ResponseEntity<Map<String, Object>> notReady(ModelNotReadyException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("detail", MODEL_NOT_LOADED));
    }

    @ExceptionHandler(InferenceFailureException.class)
    public ResponseEntity<Map<String, Object>> inferenceFailed(InferenceFailureException ex) {
        // already logged with the vector by InferenceEngine
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("detail", INTERNAL_ERROR));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> status(ResponseStatusException ex) {
        // framework reasons name internal types; the caller only gets the standard phrase
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        String reason = status != null ? status.getReasonPhrase() : "Request rejected";
        return ResponseEntity.status(ex.getStatusCode()).body(Map.of("detail", reason));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> unexpected(Exception ex) {
        log.error("Unhandled error while serving request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("detail", INTERNAL_ERROR));
    }
}
