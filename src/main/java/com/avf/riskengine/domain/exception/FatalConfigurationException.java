package com.avf.riskengine.domain.exception;

public class FatalConfigurationException extends AvfRiskException {

    public FatalConfigurationException(String message) {
        super(message);
    }

    public FatalConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
