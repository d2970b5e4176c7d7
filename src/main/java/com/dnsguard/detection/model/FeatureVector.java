package com.dnsguard.detection.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable, fixed-schema feature vector indexed by {@link Feature}.
 * Serialised as an ordered JSON object keyed by {@link Feature#getKey()}.
 */
public final class FeatureVector {

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    public static FeatureVector of(double... values) {
        if (values.length != Feature.COUNT) {
            throw new IllegalArgumentException(
                    "Expected " + Feature.COUNT + " feature values but got " + values.length);
        }
        return new FeatureVector(Arrays.copyOf(values, values.length));
    }

    public static FeatureVector of(Map<Feature, Double> values) {
        double[] data = new double[Feature.COUNT];
        for (Feature feature : Feature.values()) {
            Double value = values.get(feature);
            if (value == null) {
                throw new IllegalArgumentException("Missing feature: " + feature.getKey());
            }
            data[feature.ordinal()] = value;
        }
        return new FeatureVector(data);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static FeatureVector fromJson(Map<String, Double> byKey) {
        Map<Feature, Double> values = new EnumMap<>(Feature.class);
        byKey.forEach((key, value) -> values.put(Feature.fromKey(key), value));
        return of(values);
    }

    public double get(Feature feature) {
        return values[feature.ordinal()];
    }

    /** Values in canonical order. Returns a copy. */
    public double[] toArray() {
        return Arrays.copyOf(values, values.length);
    }

    @JsonValue
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (Feature feature : Feature.values()) {
            map.put(feature.getKey(), values[feature.ordinal()]);
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector other)) return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + asMap();
    }
}
