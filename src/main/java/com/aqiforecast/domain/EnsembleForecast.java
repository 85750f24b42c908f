package com.aqiforecast.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A forecast served to callers: either a combined ensemble prediction or the rule-based
 * fallback used when no predictor answered.
 */
@Value
@Builder(toBuilder = true)
public class EnsembleForecast {
    EnsemblePrediction prediction;
    boolean fallback;
    String fallbackReason;
    /** Predictors that failed or timed out for this request, with the reason. */
    Map<String, String> unavailable;
    /** Step of a sequence forecast, counted in hours from the request; null for a single forecast. */
    Integer horizonHours;
    Instant targetTime;
}
