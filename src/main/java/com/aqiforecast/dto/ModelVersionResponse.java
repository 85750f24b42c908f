package com.aqiforecast.dto;

import com.aqiforecast.domain.ModelVersionRecord;
import com.aqiforecast.domain.ModelVersionState;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class ModelVersionResponse {
    UUID recordId;
    String predictorId;
    String version;
    ModelVersionState state;
    boolean active;
    Map<String, Double> metrics;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant updatedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant promotedAt;
    UUID triggerId;
    String failureReason;

    public static ModelVersionResponse from(ModelVersionRecord record) {
        return ModelVersionResponse.builder()
            .recordId(record.getRecordId())
            .predictorId(record.getPredictorId())
            .version(record.getVersion())
            .state(record.getState())
            .active(record.getState() == ModelVersionState.PROMOTED)
            .metrics(record.getMetrics() != null ? record.getMetrics().asMap() : null)
            .createdAt(record.getCreatedAt())
            .updatedAt(record.getUpdatedAt())
            .promotedAt(record.getPromotedAt())
            .triggerId(record.getTriggerId())
            .failureReason(record.getFailureReason())
            .build();
    }
}
