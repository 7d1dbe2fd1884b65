package com.avf.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class PredictionResult {

    private final double probability;
    private final double linearPredictor;
    private final double intercept;
    private final List<Contribution> contributions;
}
