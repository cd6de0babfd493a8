package com.example.solarcast.ml;

import com.example.solarcast.exception.InferenceFailureException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scales a vector with the active scaler and runs the active regressor on it.
 * The pair is read once per call so a concurrent reload can never mix generations.
 */
@Service
@Slf4j
public class InferenceEngine {

    private final ModelRegistry registry;
    private final MeterRegistry meterRegistry;

    public InferenceEngine(ModelRegistry registry, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @throws com.example.solarcast.exception.ModelNotReadyException if no pair is installed
     * @throws InferenceFailureException if scaling or prediction fails
     */
    public PredictionResult predict(FeatureVector vector) {
        ArtifactPair pair = registry.current();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            double[] scaled = pair.scaler().transform(vector.toArray());
            double y = pair.regressor().predict(scaled);
            if (!Double.isFinite(y)) {
                throw new ArithmeticException("regressor returned " + y);
            }
            return PredictionResult.watts(y, pair.version());
        } catch (RuntimeException e) {
            log.error("Prediction error (model={}, vector={}): {}", pair.version(), vector, e.toString(), e);
            throw new InferenceFailureException("Inference failed for model " + pair.version(), e);
        } finally {
            sample.stop(meterRegistry.timer("forecast.inference.duration", "model", pair.version()));
        }
    }
}
