package com.avf.riskengine.domain.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class FeatureVector {

    private final List<String> names;
    private final double[] values;

    public FeatureVector(List<String> names, double[] values) {
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

    public double[] toArray() {
        return values.clone();
    }

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(names.get(i), values[i]);
        }
        return map;
    }
}
