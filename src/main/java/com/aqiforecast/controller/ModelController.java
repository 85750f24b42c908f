package com.aqiforecast.controller;

import com.aqiforecast.domain.RetrainingTrigger;
import com.aqiforecast.domain.ValidationMetric;
import com.aqiforecast.dto.DriftSummaryResponse;
import com.aqiforecast.dto.ModelStatusResponse;
import com.aqiforecast.dto.ModelVersionResponse;
import com.aqiforecast.dto.RetrainRequest;
import com.aqiforecast.dto.RetrainingConfigResponse;
import com.aqiforecast.dto.RetrainResponse;
import com.aqiforecast.dto.RetrainingReportResponse;
import com.aqiforecast.dto.TriggerCheckResponse;
import com.aqiforecast.predictor.PredictorCatalog;
import com.aqiforecast.service.ModelStatusService;
import com.aqiforecast.service.PendingTriggerSlots;
import com.aqiforecast.service.RetrainingOrchestrator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ModelController {

    private final PredictorCatalog catalog;
    private final ModelStatusService statusService;
    private final RetrainingOrchestrator orchestrator;

    @GetMapping("/models")
    public ResponseEntity<Set<String>> models() {
        return ResponseEntity.ok(catalog.ids());
    }

    @GetMapping("/models/{id}/status")
    public ResponseEntity<ModelStatusResponse> status(@PathVariable String id) {
        return ResponseEntity.ok(statusService.status(id));
    }

    @PostMapping("/models/{id}/retrain")
    public ResponseEntity<RetrainResponse> retrain(
            @PathVariable String id, @Valid @RequestBody RetrainRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /models/{}/retrain | severity={} | reason={} | requestId={}",
                 id, request.getSeverity(), request.getReason(), requestId);
        PendingTriggerSlots.Offer offer = orchestrator.requestRetrain(id, request.getReason(), request.getSeverity());
        RetrainingTrigger trigger = offer.pending();
        return ResponseEntity.accepted()
            .header("X-Request-ID", requestId)
            .body(RetrainResponse.builder()
                .predictorId(id)
                .triggerId(trigger.getId())
                .status(offer.status().name())
                .severity(trigger.getSeverity())
                .reason(trigger.getReason())
                .createdAt(trigger.getCreatedAt())
                .requestId(requestId)
                .build());
    }

    @GetMapping("/models/{id}/history")
    public ResponseEntity<List<ModelVersionResponse>> history(@PathVariable String id) {
        return ResponseEntity.ok(statusService.history(id));
    }

    @GetMapping("/models/{id}/drift")
    public ResponseEntity<DriftSummaryResponse> drift(@PathVariable String id) {
        return ResponseEntity.ok(statusService.drift(id));
    }

    @GetMapping("/models/{id}/best")
    public ResponseEntity<ModelVersionResponse> best(
            @PathVariable String id, @RequestParam(defaultValue = "RMSE") ValidationMetric metric) {
        return ResponseEntity.ok(statusService.best(id, metric));
    }

    @GetMapping("/retraining/report")
    public ResponseEntity<RetrainingReportResponse> report() {
        return ResponseEntity.ok(statusService.report());
    }

    @PostMapping("/retraining/triggers/check")
    public ResponseEntity<TriggerCheckResponse> checkTriggers() {
        log.info("POST /retraining/triggers/check");
        return ResponseEntity.ok(TriggerCheckResponse.from(orchestrator.checkTriggers()));
    }

    @GetMapping("/retraining/config")
    public ResponseEntity<RetrainingConfigResponse> config() {
        return ResponseEntity.ok(statusService.config());
    }

    private String resolveRequestId(HttpServletRequest request) {
        String header = request.getHeader("X-Request-ID");
        return header != null && !header.isBlank() ? header : UUID.randomUUID().toString();
    }
}
