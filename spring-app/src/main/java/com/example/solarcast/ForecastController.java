package com.example.solarcast;

import com.example.solarcast.dto.HealthResponse;
import com.example.solarcast.dto.PredictionRequest;
import com.example.solarcast.dto.PredictionResponse;
import com.example.solarcast.dto.StatusResponse;
import com.example.solarcast.validation.FeatureValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Public HTTP contract of the solar power forecast service.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li><b>GET /</b> – service status; {@code "warning"} while no model is loaded.</li>
 *   <li><b>GET /health</b> – liveness plus the active model version.</li>
 *   <li><b>POST /predict</b> – one {@link PredictionRequest} in, one {@link PredictionResponse} out.</li>
 * </ul>
 *
 * <h2>Status codes for /predict</h2>
 * <ul>
 *   <li>{@code 200} – prediction served (and queued for the audit log).</li>
 *   <li>{@code 422} – body unreadable or fields out of range; every bad field is listed.</li>
 *   <li>{@code 503} – no model loaded; checked before the body is looked at.</li>
 *   <li>{@code 500} – inference failed; details stay in the server log.</li>
 * </ul>
 * Mapping of failures to codes lives in {@link GlobalExceptionHandler}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * curl -s -H 'Content-Type: application/json' \
 *      -d '{"temperature":25.5,"humidity":45.0,"ghi":600.5,"hour_sin":-0.5,
 *           "hour_cos":-0.866,"power_t_1":150.0,"power_t_2":140.0}' \
 *      http://127.0.0.1:8000/predict
 * }</pre>
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class ForecastController {

    static final String DOCS_URL = "/docs";
    static final int MAX_BODY_BYTES = 64 * 1024;

    private final ForecastService forecastService;
    private final FeatureValidator validator;
    private final ObjectMapper objectMapper;

    @GetMapping("/")
    public Mono<StatusResponse> status() {
        if (!forecastService.ready()) {
            return Mono.just(new StatusResponse("warning", "Service running but models not loaded", DOCS_URL));
        }
        return Mono.just(new StatusResponse("ok", "Solar Forecasting API is ready", DOCS_URL));
    }

    @GetMapping("/health")
    public Mono<HealthResponse> health() {
        return Mono.just(new HealthResponse("ok", forecastService.activeVersion()));
    }

    @Operation(summary = "Predicts solar power output based on weather and lag features",
            requestBody = @io.swagger.v3.oas.annotations.parameters.RequestBody(required = true,
                    content = @Content(schema = @Schema(implementation = PredictionRequest.class))))
    @PostMapping(path = "/predict", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<PredictionResponse> predict(ServerHttpRequest request) {
        long t0 = System.nanoTime();
        // raw bytes, whatever the Content-Type: nothing is read until the model check has passed
        Mono<JsonNode> payload = DataBufferUtils.join(request.getBody(), MAX_BODY_BYTES)
                .map(this::readTree)
                .onErrorMap(validator::unreadableBody);
        return forecastService.predict(payload)
                .map(PredictionResponse::from)
                .doOnNext(res -> log.info("prediction served: predicted_power={}, model_version={}, latency_ms={}",
                        res.predictedPower(), res.modelVersion(), (System.nanoTime() - t0) / 1_000_000));
    }

    private JsonNode readTree(DataBuffer buffer) {
        try (InputStream in = buffer.asInputStream(true)) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
