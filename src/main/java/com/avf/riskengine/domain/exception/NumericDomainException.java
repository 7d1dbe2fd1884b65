package com.avf.riskengine.domain.exception;

import lombok.Getter;

@Getter
public class NumericDomainException extends AvfRiskException {

    private final String variableName;
    private final double value;

    public NumericDomainException(String variableName, double value) {
        super(String.format("Value %s for '%s' is outside the log1p domain (must be >= -1)", value, variableName));
        this.variableName = variableName;
        this.value = value;
    }
}
