package com.example.solarcast.validation;

import java.util.List;

/** Carries every rejected field of one request, never just the first. */
public class FeatureValidationException extends RuntimeException {

    private final List<FieldViolation> violations;

    public FeatureValidationException(List<FieldViolation> violations) {
        super("Invalid prediction input: " + violations.size() + " field(s) rejected");
        this.violations = List.copyOf(violations);
    }

    public static FeatureValidationException malformedBody(String message) {
        return new FeatureValidationException(List.of(FieldViolation.malformed("body", message, null)));
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }
}
