package com.avf.riskengine.infra.artifact.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "avf.artifacts")
public class ArtifactProperties {

    private List<String> candidateDirectories = List.of("Models", "../Models");

    private String modelFile = "lr_model.json";

    private String scalerFile = "scaler.json";

    private String winsorLimitsFile = "winsor_limits.json";

    private String statsFile = "data_stats.json";
}
