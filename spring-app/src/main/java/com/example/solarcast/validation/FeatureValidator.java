package com.example.solarcast.validation;

import com.example.solarcast.dto.PredictionRequest;
import com.example.solarcast.ml.Feature;
import com.example.solarcast.ml.FeatureRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a raw JSON payload into a {@link FeatureRecord}, or rejects it with the full list
 * of offending fields.
 * <p>
 * Type problems (missing, null, non-numeric, NaN/Infinity) are {@code malformed_input};
 * numbers outside the bounds declared on {@link PredictionRequest} are
 * {@code validation_bounds}. There is no cross-field check.
 */
@Component
@Slf4j
public class FeatureValidator {

    private final Validator validator;

    public FeatureValidator(Validator validator) {
        this.validator = validator;
    }

    public FeatureRecord validate(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw FeatureValidationException.malformedBody("request body must be a JSON object");
        }

        Map<Feature, Double> values = new EnumMap<>(Feature.class);
        List<FieldViolation> violations = new ArrayList<>();
        for (Feature feature : Feature.values()) {
            JsonNode node = payload.get(feature.column());
            if (node == null || node.isNull()) {
                violations.add(FieldViolation.malformed(feature.column(), "field required", null));
            } else if (!node.isNumber()) {
                violations.add(FieldViolation.malformed(feature.column(), "must be a number", node.asText()));
            } else if (!Double.isFinite(node.doubleValue())) {
                violations.add(FieldViolation.malformed(feature.column(), "must be finite", node.asText()));
            } else {
                values.put(feature, node.doubleValue());
                violations.addAll(checkBounds(feature, node.doubleValue()));
            }
        }

        if (!violations.isEmpty()) {
            log.debug("Rejected prediction input: {}", violations);
            throw new FeatureValidationException(violations);
        }

        return new FeatureRecord(
                values.get(Feature.TEMPERATURE),
                values.get(Feature.HUMIDITY),
                values.get(Feature.GHI),
                values.get(Feature.HOUR_SIN),
                values.get(Feature.HOUR_COS),
                values.get(Feature.POWER_T_1),
                values.get(Feature.POWER_T_2));
    }

    /**
     * Maps a body that could not be read at all (bad JSON, oversized body) to a
     * single {@code malformed_input} entry, naming the field when the parser knows it.
     */
    public FeatureValidationException unreadableBody(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof JsonMappingException jme && !jme.getPath().isEmpty()) {
                String field = jme.getPath().get(jme.getPath().size() - 1).getFieldName();
                if (field != null) {
                    return new FeatureValidationException(List.of(
                            FieldViolation.malformed(field, jme.getOriginalMessage(), null)));
                }
            }
            if (t instanceof JsonProcessingException jpe) {
                return FeatureValidationException.malformedBody("malformed JSON: " + jpe.getOriginalMessage());
            }
        }
        return FeatureValidationException.malformedBody("request body is missing or unreadable");
    }

    private List<FieldViolation> checkBounds(Feature feature, double value) {
        List<FieldViolation> out = new ArrayList<>();
        for (ConstraintViolation<PredictionRequest> cv
                : validator.validateValue(PredictionRequest.class, feature.property(), value)) {
            out.add(FieldViolation.outOfBounds(feature.column(), cv.getMessage(), value));
        }
        return out;
    }
}
