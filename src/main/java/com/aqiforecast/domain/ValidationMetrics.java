package com.aqiforecast.domain;

import java.util.LinkedHashMap;
import java.util.Map;

public record ValidationMetrics(double rmse, double mae, double accuracyWithinThreshold, long sampleCount) {

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("rmse", rmse);
        map.put("mae", mae);
        map.put("accuracy_within_threshold", accuracyWithinThreshold);
        map.put("sample_count", (double) sampleCount);
        return map;
    }
}
