package com.avf.riskengine.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class DescriptiveStats {

    public static final String MEDIAN_KEY = "50%";

    private final Map<String, Map<String, Double>> statsByVariable;

    public DescriptiveStats(Map<String, Map<String, Double>> source) {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        source.forEach((name, stats) -> {
            if (stats == null) return;
            Map<String, Double> values = new LinkedHashMap<>();
            stats.forEach((key, value) -> {
                if (value != null) values.put(key, value);
            });
            copy.putIfAbsent(name.trim().toLowerCase(Locale.ROOT), Collections.unmodifiableMap(values));
        });
        this.statsByVariable = Collections.unmodifiableMap(copy);
    }

    public static DescriptiveStats empty() {
        return new DescriptiveStats(Map.of());
    }

    public Optional<Double> median(String variableName) {
        return get(variableName, MEDIAN_KEY);
    }

    public Optional<Double> get(String variableName, String statistic) {
        if (variableName == null) return Optional.empty();
        Map<String, Double> stats = statsByVariable.get(variableName.trim().toLowerCase(Locale.ROOT));
        if (stats == null) return Optional.empty();
        return Optional.ofNullable(stats.get(statistic));
    }

    public boolean isEmpty() {
        return statsByVariable.isEmpty();
    }
}
