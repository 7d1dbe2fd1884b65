package com.avf.riskengine.domain.exception;

public class FeatureShapeException extends AvfRiskException {

    public FeatureShapeException(String message) {
        super(message);
    }

    public static FeatureShapeException lengthMismatch(String stage, int features, int params) {
        return new FeatureShapeException(String.format(
                "%s: feature vector has %d entries but parameters have %d", stage, features, params));
    }

    public static FeatureShapeException nameMismatch(String stage, int index, String feature, String param) {
        return new FeatureShapeException(String.format(
                "%s: feature #%d is '%s' but parameters expect '%s'", stage, index, feature, param));
    }
}
