package com.example.solarcast.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One rejected input field as reported in a 422 body.
 *
 * <pre>{@code
 * {"field": "temperature", "type": "validation_bounds",
 *  "message": "must be less than or equal to 60", "rejected_value": 61.0}
 * }</pre>
 */
public record FieldViolation(
        @JsonProperty("field") String field,
        @JsonProperty("type") Reason reason,
        @JsonProperty("message") String message,
        @JsonProperty("rejected_value") Object rejectedValue) {

    public enum Reason {
        /** Missing, null, not a number, or not finite. */
        MALFORMED_INPUT("malformed_input"),
        /** A number outside the field's declared range. */
        VALIDATION_BOUNDS("validation_bounds");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }
    }

    public static FieldViolation malformed(String field, String message, Object rejectedValue) {
        return new FieldViolation(field, Reason.MALFORMED_INPUT, message, rejectedValue);
    }

    public static FieldViolation outOfBounds(String field, String message, Object rejectedValue) {
        return new FieldViolation(field, Reason.VALIDATION_BOUNDS, message, rejectedValue);
    }
}
