package com.avf.riskengine.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class WinsorLimits {

    private final Map<String, Bound> bounds;
    private final List<String> variableNames;

    public WinsorLimits(Map<String, Bound> source) {
        Map<String, Bound> normalized = new LinkedHashMap<>();
        source.forEach((name, bound) -> normalized.putIfAbsent(normalize(name), bound));
        this.bounds = Collections.unmodifiableMap(normalized);
        this.variableNames = List.copyOf(source.keySet());
    }

    public static WinsorLimits empty() {
        return new WinsorLimits(Map.of());
    }

    public Optional<Bound> find(String variableName) {
        if (variableName == null) return Optional.empty();
        return Optional.ofNullable(bounds.get(normalize(variableName)));
    }

    public List<String> getVariableNames() {
        return variableNames;
    }

    public int size() {
        return bounds.size();
    }

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public record Bound(double lower, double upper) {

        public double clamp(double value) {
            return Math.max(lower, Math.min(value, upper));
        }
    }
}
