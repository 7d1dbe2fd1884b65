package com.avf.riskengine;

import com.avf.riskengine.domain.exception.FatalConfigurationException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AvfRiskEngineApplicationTest {

    @Test
    void startupHaltsWhenNoArtifactDirectoryExists() {
        SpringApplicationBuilder builder = new SpringApplicationBuilder(AvfRiskEngineApplication.class)
                .web(WebApplicationType.NONE)
                .properties("avf.artifacts.candidate-directories=does/not/exist,also/missing");

        assertThatThrownBy(builder::run)
                .hasRootCauseInstanceOf(FatalConfigurationException.class)
                .rootCause()
                .hasMessageContaining("does/not/exist");
    }
}
