package com.avf.riskengine.domain.exception;

public class AvfRiskException extends RuntimeException {

    public AvfRiskException(String message) {
        super(message);
    }

    public AvfRiskException(String message, Throwable cause) {
        super(message, cause);
    }
}
