package com.avf.riskengine.infra.artifact.config;

import com.avf.riskengine.domain.model.ModelArtifacts;
import com.avf.riskengine.infra.artifact.ArtifactStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ArtifactConfig {

    @Bean
    public ModelArtifacts modelArtifacts(ArtifactStore artifactStore, ArtifactProperties properties) {
        return artifactStore.load(properties.getCandidateDirectories());
    }
}
