package com.aqiforecast.dto;

import com.aqiforecast.domain.EnsembleForecast;
import com.aqiforecast.domain.EnsemblePrediction;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastResponse {
    double value;
    double lowerBound;
    double upperBound;
    double confidenceLevel;
    double combinedVariance;
    Map<String, Double> contributions;
    Map<String, Double> weightsUsed;
    boolean fallback;
    String fallbackReason;
    Map<String, String> unavailablePredictors;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;
    Integer horizonHours;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant targetTime;
    String requestId;

    public static ForecastResponse from(EnsembleForecast forecast, String requestId) {
        EnsemblePrediction p = forecast.getPrediction();
        return ForecastResponse.builder()
            .value(p.getValue())
            .lowerBound(p.getConfidenceLower())
            .upperBound(p.getConfidenceUpper())
            .confidenceLevel(p.getConfidenceLevel())
            .combinedVariance(p.getCombinedVariance())
            .contributions(p.getPerModelContributions())
            .weightsUsed(p.getWeightsUsed())
            .fallback(forecast.isFallback())
            .fallbackReason(forecast.getFallbackReason())
            .unavailablePredictors(forecast.getUnavailable())
            .timestamp(p.getTimestamp())
            .horizonHours(forecast.getHorizonHours())
            .targetTime(forecast.getTargetTime())
            .requestId(requestId)
            .build();
    }
}
