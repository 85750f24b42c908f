package com.aqiforecast.controller;

import com.aqiforecast.domain.EnsembleForecast;
import com.aqiforecast.domain.WeightVector;
import com.aqiforecast.dto.ForecastRequest;
import com.aqiforecast.dto.ForecastResponse;
import com.aqiforecast.dto.MeasurementRequest;
import com.aqiforecast.dto.MeasurementResponse;
import com.aqiforecast.dto.SequenceForecastRequest;
import com.aqiforecast.dto.SequenceForecastResponse;
import com.aqiforecast.dto.WeightsResponse;
import com.aqiforecast.service.EnsembleForecastService;
import com.aqiforecast.service.MeasurementFeedService;
import com.aqiforecast.service.WeightStore;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ForecastController {

    private final EnsembleForecastService forecastService;
    private final MeasurementFeedService measurementFeed;
    private final WeightStore weightStore;
    private final Clock clock;

    @PostMapping("/forecasts")
    public Mono<ResponseEntity<ForecastResponse>> forecast(
            @Valid @RequestBody ForecastRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /forecasts | features={} | requestId={}", request.getFeatures().keySet(), requestId);
        Mono<EnsembleForecast> forecast = request.getConfidenceLevel() != null
            ? forecastService.forecast(request.getFeatures(), request.getConfidenceLevel())
            : forecastService.forecast(request.getFeatures());
        return forecast.map(f -> ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(ForecastResponse.from(f, requestId)));
    }

    @PostMapping("/forecasts/sequence")
    public Mono<ResponseEntity<SequenceForecastResponse>> forecastSequence(
            @Valid @RequestBody SequenceForecastRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        int hours = request.getHours() != null ? request.getHours() : 24;
        log.info("POST /forecasts/sequence | hours={} | features={} | requestId={}",
                 hours, request.getFeatures().keySet(), requestId);
        return forecastService.forecastSequence(request.getFeatures(), hours, request.getHourlyOverrides())
            .map(steps -> ResponseEntity.ok()
                .header("X-Request-ID", requestId)
                .body(SequenceForecastResponse.builder()
                    .hours(hours)
                    .fallbackSteps(steps.stream().filter(EnsembleForecast::isFallback).count())
                    .steps(steps.stream().map(f -> ForecastResponse.from(f, requestId)).toList())
                    .requestId(requestId)
                    .build()));
    }

    @PostMapping("/measurements")
    public ResponseEntity<MeasurementResponse> measurement(
            @Valid @RequestBody MeasurementRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        Instant timestamp = request.getTimestamp() != null ? request.getTimestamp() : clock.instant();
        Map<String, Double> features = request.getFeatures() != null ? request.getFeatures() : Map.of();

        int scored;
        if (request.getPredictorId() != null) {
            scored = measurementFeed.onMeasurement(request.getPredictorId(), features, request.getActualValue(),
                timestamp, request.getPredictedValue()) ? 1 : 0;
        } else {
            scored = measurementFeed.onMeasurement(features, request.getActualValue(), timestamp);
        }
        return ResponseEntity.accepted()
            .header("X-Request-ID", requestId)
            .body(MeasurementResponse.builder().predictorsScored(scored).requestId(requestId).build());
    }

    @GetMapping("/ensemble/weights")
    public ResponseEntity<WeightsResponse> weights() {
        WeightVector weights = weightStore.current();
        return ResponseEntity.ok(WeightsResponse.builder()
            .weights(weights.asMap())
            .sum(weights.sum())
            .build());
    }

    private String resolveRequestId(HttpServletRequest request) {
        String header = request.getHeader("X-Request-ID");
        return header != null && !header.isBlank() ? header : UUID.randomUUID().toString();
    }
}
