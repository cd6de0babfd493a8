package com.example.solarcast.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** {@code GET /health} body. {@code model_version} is {@code null} until a model is loaded. */
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("model_version") String modelVersion) {}
