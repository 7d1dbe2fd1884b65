package com.avf.riskengine.infra.artifact.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelArtifactFile {

    private List<String> featureNames;
    private List<Double> coefficients;
    private Double intercept;
}
