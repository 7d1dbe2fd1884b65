package com.avf.riskengine.api.dto;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

@Getter
@Builder
public class ModelInfoResponse {

    private final String artifactDirectory;
    private final Instant loadedAt;
    private final int featureCount;
    private final List<String> featureNames;
    private final double intercept;
    private final List<String> winsorizedVariables;
    private final boolean descriptiveStatsLoaded;
}
