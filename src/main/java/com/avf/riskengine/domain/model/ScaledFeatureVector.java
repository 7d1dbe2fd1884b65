package com.avf.riskengine.domain.model;

import java.util.List;

public final class ScaledFeatureVector {

    private final List<String> names;
    private final double[] values;

    public ScaledFeatureVector(List<String> names, double[] values) {
        if (names.size() != values.length) {
            throw new IllegalArgumentException("names and values differ in length: "
                    + names.size() + " vs " + values.length);
        }
        this.names = List.copyOf(names);
        this.values = values.clone();
    }

    public int size() {
        return values.length;
    }

    public String name(int i) {
        return names.get(i);
    }

    public double value(int i) {
        return values[i];
    }

    public List<String> getNames() {
        return names;
    }
}
