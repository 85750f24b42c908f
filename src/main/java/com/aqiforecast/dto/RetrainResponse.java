package com.aqiforecast.dto;

import com.aqiforecast.domain.Severity;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class RetrainResponse {
    String predictorId;
    UUID triggerId;
    /** ACCEPTED, REPLACED or DEDUPLICATED. */
    String status;
    Severity severity;
    String reason;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    String requestId;
}
