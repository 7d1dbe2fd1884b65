package com.avf.riskengine.domain.model;

public record InputDefaults(
        double mlr,
        double crp,
        double triglycerides,
        double nlr,
        int ijvc,
        int sex
) {
}
