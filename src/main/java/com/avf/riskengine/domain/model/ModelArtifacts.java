package com.avf.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
public class ModelArtifacts {

    private final ModelParams model;
    private final ScalerParams scaler;
    private final WinsorLimits winsorLimits;

    @Builder.Default
    private final DescriptiveStats stats = DescriptiveStats.empty();

    private final String sourceDirectory;
    private final Instant loadedAt;
}
