package com.example.solarcast.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** {@code GET /} body; {@code status} is {@code "warning"} while no model is loaded. */
public record StatusResponse(
        @JsonProperty("status") String status,
        @JsonProperty("message") String message,
        @JsonProperty("documentation_url") String documentationUrl) {}
