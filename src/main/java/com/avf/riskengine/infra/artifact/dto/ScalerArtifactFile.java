package com.avf.riskengine.infra.artifact.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScalerArtifactFile {

    private List<String> featureNames;
    private List<Double> mean;
    private List<Double> scale;
}
