package com.example.solarcast;

import com.example.solarcast.audit.AuditLogger;
import com.example.solarcast.exception.InferenceFailureException;
import com.example.solarcast.exception.ModelNotReadyException;
import com.example.solarcast.ml.ArtifactPair;
import com.example.solarcast.ml.FeatureRecord;
import com.example.solarcast.ml.FeatureVectorAssembler;
import com.example.solarcast.ml.InferenceEngine;
import com.example.solarcast.ml.ModelRegistry;
import com.example.solarcast.ml.PredictionResult;
import com.example.solarcast.validation.FeatureValidationException;
import com.example.solarcast.validation.FeatureValidator;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Request pipeline behind {@code POST /predict}:
 *  • availability check, before the body is even read
 *  • validate → assemble → infer
 *  • audit row, best effort, after the result is fixed
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ForecastService {

    private final ModelRegistry registry;
    private final FeatureValidator validator;
    private final FeatureVectorAssembler assembler;
    private final InferenceEngine engine;
    private final AuditLogger auditLogger;
    private final MeterRegistry meterRegistry;

    /**
     * @param payload raw request body; errors in it must already be {@link FeatureValidationException}
     * @return the prediction, or an error signal carrying one of the typed failures
     */
    public Mono<PredictionResult> predict(Mono<JsonNode> payload) {
        if (!registry.isReady()) {
            count("unavailable");
            return Mono.error(new ModelNotReadyException());
        }
        return payload
                .switchIfEmpty(Mono.error(() -> FeatureValidationException.malformedBody("request body is required")))
                .map(validator::validate)
                .map(this::score)
                .doOnError(this::countFailure);
    }

    public boolean ready() {
        return registry.isReady();
    }

    public String activeVersion() {
        return registry.snapshot().map(ArtifactPair::version).orElse(null);
    }

    private PredictionResult score(FeatureRecord record) {
        PredictionResult result = engine.predict(assembler.assemble(record));
        auditLogger.record(record, result);
        count("success");
        log.debug("Predicted {} {} with model {}", result.value(), result.unit(), result.modelVersion());
        return result;
    }

    private void countFailure(Throwable error) {
        if (error instanceof FeatureValidationException) {
            count("invalid");
        } else if (error instanceof ModelNotReadyException) {
            count("unavailable");
        } else if (error instanceof InferenceFailureException) {
            count("failure");
        }
    }

    private void count(String outcome) {
        meterRegistry.counter("forecast.predictions", "outcome", outcome).increment();
    }
}
