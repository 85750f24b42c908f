package com.aqiforecast.service;

import com.aqiforecast.config.ForecastProperties;
import com.aqiforecast.domain.PerformanceRecord;
import com.aqiforecast.domain.WeightVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Inverse-RMSE weighting with exponential smoothing and a per-predictor floor.
 * Pure: the caller owns publication of the result.
 */
@Slf4j
@Component
public class WeightAdapter {

    private final double alpha;
    private final double floor;
    private final double rmseFloor;
    private final double missingSnapshotDecay;

    public WeightAdapter(ForecastProperties properties) {
        ForecastProperties.Weights config = properties.getWeights();
        this.alpha = config.getSmoothingAlpha();
        this.floor = config.getMinWeightFloor();
        this.rmseFloor = config.getRmseFloor();
        this.missingSnapshotDecay = config.getMissingSnapshotDecay();
    }

    public WeightVector recompute(Map<String, PerformanceRecord> snapshots, WeightVector previous) {
        Set<String> ids = new TreeSet<>(previous.predictorIds());
        ids.addAll(snapshots.keySet());
        if (ids.isEmpty()) {
            return WeightVector.empty();
        }

        double inverseSum = 0.0d;
        for (PerformanceRecord record : snapshots.values()) {
            inverseSum += 1.0d / Math.max(record.rmse(), rmseFloor);
        }

        Map<String, Double> raw = new LinkedHashMap<>();
        for (String id : ids) {
            PerformanceRecord record = snapshots.get(id);
            if (record != null) {
                raw.put(id, (1.0d / Math.max(record.rmse(), rmseFloor)) / inverseSum);
            } else {
                raw.put(id, previous.weightOf(id) * missingSnapshotDecay);
            }
        }
        raw = normalize(raw);

        Map<String, Double> smoothed = new LinkedHashMap<>();
        raw.forEach((id, w) -> smoothed.put(id,
            previous.contains(id) ? alpha * w + (1.0d - alpha) * previous.weightOf(id) : w));

        return WeightVector.of(applyFloor(normalize(smoothed)));
    }

    private Map<String, Double> normalize(Map<String, Double> weights) {
        double sum = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Double> result = new LinkedHashMap<>();
        if (sum <= 0.0d) {
            weights.keySet().forEach(id -> result.put(id, 1.0d / weights.size()));
            return result;
        }
        weights.forEach((id, w) -> result.put(id, w / sum));
        return result;
    }

    /**
     * Pins every weight that would fall below the floor at the floor and shares the remaining
     * mass among the others in proportion to their current weight, until none is below.
     */
    private Map<String, Double> applyFloor(Map<String, Double> weights) {
        int n = weights.size();
        if (floor <= 0.0d) {
            return weights;
        }
        if (floor * n >= 1.0d) {
            log.warn("Weight floor {} cannot hold for {} predictors, using uniform weights", floor, n);
            Map<String, Double> uniform = new LinkedHashMap<>();
            weights.keySet().forEach(id -> uniform.put(id, 1.0d / n));
            return uniform;
        }

        Set<String> pinned = new HashSet<>();
        Map<String, Double> result = new LinkedHashMap<>(weights);
        boolean changed = true;
        while (changed) {
            changed = false;
            double remaining = 1.0d - floor * pinned.size();
            double freeSum = 0.0d;
            for (Map.Entry<String, Double> e : weights.entrySet()) {
                if (!pinned.contains(e.getKey())) {
                    freeSum += e.getValue();
                }
            }
            int free = n - pinned.size();
            for (Map.Entry<String, Double> e : weights.entrySet()) {
                String id = e.getKey();
                if (pinned.contains(id)) {
                    result.put(id, floor);
                    continue;
                }
                double w = freeSum > 0.0d ? e.getValue() / freeSum * remaining : remaining / free;
                if (w < floor) {
                    pinned.add(id);
                    changed = true;
                }
                result.put(id, Math.min(1.0d, w));
            }
        }
        return result;
    }
}
