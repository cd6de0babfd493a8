package com.example.solarcast;

import com.example.solarcast.ml.ArtifactPair;
import com.example.solarcast.ml.Feature;
import com.example.solarcast.ml.ModelRegistry;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/** Read-only operator view of the model registry. */
@RestController
@RequestMapping("/v1/model")
public class ModelController {

    private final ModelRegistry registry;
    public ModelController(ModelRegistry registry){ this.registry = registry; }

    @GetMapping
    public ModelView view() {
        var pair = registry.snapshot();
        return new ModelView(
                registry.state(),
                pair.map(ArtifactPair::version).orElse(null),
                pair.map(ArtifactPair::loadedAt).orElse(null),
                pair.map(p -> p.regressor().algorithm()).orElse(null),
                Feature.columns(),
                registry.lastFailure().orElse(null));
    }

    public record ModelView(
            @JsonProperty("state") ModelRegistry.State state,
            @JsonProperty("model_version") String modelVersion,
            @JsonProperty("loaded_at") Instant loadedAt,
            @JsonProperty("regressor_type") String regressorType,
            @JsonProperty("feature_order") List<String> featureOrder,
            @JsonProperty("last_failure") String lastFailure) {}
}
