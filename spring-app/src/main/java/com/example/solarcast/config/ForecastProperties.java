package com.example.solarcast.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized settings for the forecast service, bound from the {@code forecast.*}
 * keys in {@code application.yaml}.
 *
 * <pre>{@code
 * forecast:
 *   model:
 *     base-dir: models
 *     version: v2
 *   audit:
 *     file: logs/prediction_logs.csv
 * }</pre>
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "forecast")
public class ForecastProperties {

    @Data
    @Validated
    public static class ModelProperties {
        /** Directory holding {@code scaler_<version>.json} and {@code model_<version>.json}. */
        @NotBlank
        private String baseDir = "models";
        /** Artifact generation loaded at startup. */
        @NotBlank
        private String version = "v2";
        private boolean loadOnStartup = true;
    }

    @Data
    @Validated
    public static class AuditProperties {
        @NotBlank
        private String file = "logs/prediction_logs.csv";
        private boolean enabled = true;
        /** Rows waiting for the writer thread; further rows are dropped and counted. */
        @Min(1)
        private int queueCapacity = 10_000;
    }

    @Valid
    @NotNull
    private ModelProperties model = new ModelProperties();

    @Valid
    @NotNull
    private AuditProperties audit = new AuditProperties();
}
