package com.avf.riskengine.domain.exception;

public class InputValidationException extends AvfRiskException {

    public InputValidationException(String message) {
        super(message);
    }
}
