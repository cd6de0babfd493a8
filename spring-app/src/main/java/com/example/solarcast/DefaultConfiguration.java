package com.example.solarcast;

import com.example.solarcast.audit.AuditLogger;
import com.example.solarcast.config.ForecastProperties;
import com.example.solarcast.ml.ArtifactStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Application-wide beans that need wiring from {@link ForecastProperties}.
 *
 * <h2>Beans</h2>
 * <ul>
 *   <li>{@link Clock} – UTC system clock; audit timestamps and artifact load times.</li>
 *   <li>{@link ArtifactStore} – reads artifact files from {@code forecast.model.base-dir}
 *       with the Boot-configured {@link ObjectMapper}.</li>
 *   <li>{@link AuditLogger} – prediction CSV at {@code forecast.audit.file}; its writer
 *       thread is stopped when the context closes.</li>
 *   <li>{@link OpenAPI} – metadata for the document served at {@code /docs}.</li>
 * </ul>
 */
@Configuration
public class DefaultConfiguration {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    ArtifactStore artifactStore(ForecastProperties props, ObjectMapper objectMapper, Clock clock) {
        return new ArtifactStore(Paths.get(props.getModel().getBaseDir()), objectMapper, clock);
    }

    @Bean
    AuditLogger auditLogger(ForecastProperties props, Clock clock, MeterRegistry meterRegistry) {
        var audit = props.getAudit();
        return new AuditLogger(Paths.get(audit.getFile()), audit.isEnabled(), clock, meterRegistry,
                audit.getQueueCapacity());
    }

    @Bean
    OpenAPI forecastOpenApi() {
        return new OpenAPI().info(new Info()
                .title("Solar Power Prediction API")
                .version("2.0")
                .description("Production-ready API for Solar Irradiance Forecasting"));
    }
}
