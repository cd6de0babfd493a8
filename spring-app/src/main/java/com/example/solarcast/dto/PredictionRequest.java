package com.example.solarcast.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

/**
 * Inbound payload of {@code POST /predict}.
 *
 * <h2>Fields and bounds (inclusive)</h2>
 * <ul>
 *   <li><b>temperature</b> – ambient temperature in °C, {@code [-10, 60]}.</li>
 *   <li><b>humidity</b> – relative humidity in %, {@code [0, 100]}.</li>
 *   <li><b>ghi</b> – global horizontal irradiance in W/m², {@code >= 0}.</li>
 *   <li><b>hour_sin</b>, <b>hour_cos</b> – hour of day encoded as
 *       {@code sin(2πh/24)} and {@code cos(2πh/24)}. Not range-checked; the caller's
 *       feature engineering is trusted.</li>
 *   <li><b>power_t_1</b>, <b>power_t_2</b> – power output one and two hours ago, {@code >= 0}.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * {
 *   "temperature": 25.5,
 *   "humidity": 45.0,
 *   "ghi": 600.5,
 *   "hour_sin": -0.5,
 *   "hour_cos": -0.866,
 *   "power_t_1": 150.0,
 *   "power_t_2": 140.0
 * }
 * }</pre>
 *
 * Components are boxed so a missing field can be told apart from zero. The constraint
 * annotations are the single source of the bounds; {@code FeatureValidator} applies them
 * per property.
 */
@Schema(name = "SolarInput")
public record PredictionRequest(
        @Schema(description = "Ambient temperature in Celsius", example = "25.5")
        @NotNull @DecimalMin("-10") @DecimalMax("60")
        Double temperature,

        @Schema(description = "Relative humidity %", example = "45.0")
        @NotNull @DecimalMin("0") @DecimalMax("100")
        Double humidity,

        @Schema(description = "Global Horizontal Irradiance", example = "600.5")
        @NotNull @DecimalMin("0")
        Double ghi,

        @Schema(description = "Cyclical hour feature (Sine)", example = "-0.5")
        @JsonProperty("hour_sin") @NotNull
        Double hourSin,

        @Schema(description = "Cyclical hour feature (Cosine)", example = "-0.866")
        @JsonProperty("hour_cos") @NotNull
        Double hourCos,

        @Schema(description = "Power output 1 hour ago", example = "150.0")
        @JsonProperty("power_t_1") @NotNull @DecimalMin("0")
        Double powerT1,

        @Schema(description = "Power output 2 hours ago", example = "140.0")
        @JsonProperty("power_t_2") @NotNull @DecimalMin("0")
        Double powerT2) {}
