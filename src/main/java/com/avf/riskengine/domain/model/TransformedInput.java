package com.avf.riskengine.domain.model;

public record TransformedInput(
        double logMlr,
        double logCrp,
        double logTriglycerides,
        double logNlr,
        double ijvc,
        double sex
) {
}
