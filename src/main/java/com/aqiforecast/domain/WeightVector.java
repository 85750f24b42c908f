package com.aqiforecast.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable predictor-id to weight mapping. Instances are never modified; a new vector is
 * published in place of the old one.
 */
public final class WeightVector {

    private static final WeightVector EMPTY = new WeightVector(Map.of());

    private final Map<String, Double> weights;

    private WeightVector(Map<String, Double> weights) {
        this.weights = weights;
    }

    public static WeightVector empty() {
        return EMPTY;
    }

    public static WeightVector of(Map<String, Double> weights) {
        TreeMap<String, Double> copy = new TreeMap<>();
        weights.forEach((id, w) -> {
            if (w == null || Double.isNaN(w) || w < 0.0d || w > 1.0d) {
                throw new IllegalArgumentException("Weight of '" + id + "' must be within [0, 1], was " + w);
            }
            copy.put(id, w);
        });
        return new WeightVector(Collections.unmodifiableMap(copy));
    }

    public static WeightVector uniform(Collection<String> predictorIds) {
        if (predictorIds.isEmpty()) {
            return EMPTY;
        }
        double share = 1.0d / predictorIds.size();
        Map<String, Double> map = new LinkedHashMap<>();
        predictorIds.forEach(id -> map.put(id, share));
        return of(map);
    }

    public double weightOf(String predictorId) {
        return weights.getOrDefault(predictorId, 0.0d);
    }

    public boolean contains(String predictorId) {
        return weights.containsKey(predictorId);
    }

    public Set<String> predictorIds() {
        return weights.keySet();
    }

    public Map<String, Double> asMap() {
        return weights;
    }

    public double sum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    public int size() {
        return weights.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof WeightVector other && weights.equals(other.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "WeightVector" + weights;
    }
}
