package com.avf.riskengine.domain.model;

public record Contribution(
        String feature,
        String label,
        double value
) {
}
