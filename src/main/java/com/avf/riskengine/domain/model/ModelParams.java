package com.avf.riskengine.domain.model;

import java.util.List;

public final class ModelParams {

    private final List<String> featureNames;
    private final double[] coefficients;
    private final double intercept;

    public ModelParams(List<String> featureNames, double[] coefficients, double intercept) {
        if (featureNames.size() != coefficients.length) {
            throw new IllegalArgumentException("featureNames and coefficients differ in length: "
                    + featureNames.size() + " vs " + coefficients.length);
        }
        this.featureNames = List.copyOf(featureNames);
        this.coefficients = coefficients.clone();
        this.intercept = intercept;
    }

    public int size() {
        return coefficients.length;
    }

    public String featureName(int i) {
        return featureNames.get(i);
    }

    public double coefficient(int i) {
        return coefficients[i];
    }

    public double getIntercept() {
        return intercept;
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }
}
