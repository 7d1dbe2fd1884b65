package com.avf.riskengine.domain.model;

import java.util.List;

public final class ScalerParams {

    private final List<String> featureNames;
    private final double[] mean;
    private final double[] scale;

    public ScalerParams(List<String> featureNames, double[] mean, double[] scale) {
        if (featureNames.size() != mean.length || mean.length != scale.length) {
            throw new IllegalArgumentException("featureNames, mean and scale differ in length: "
                    + featureNames.size() + "/" + mean.length + "/" + scale.length);
        }
        this.featureNames = List.copyOf(featureNames);
        this.mean = mean.clone();
        this.scale = scale.clone();
    }

    public int size() {
        return mean.length;
    }

    public String featureName(int i) {
        return featureNames.get(i);
    }

    public double mean(int i) {
        return mean[i];
    }

    public double scale(int i) {
        return scale[i];
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }
}
