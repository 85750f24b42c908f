package com.aqiforecast.service;

import com.aqiforecast.config.ForecastProperties;
import com.aqiforecast.domain.ModelVersionRecord;
import com.aqiforecast.domain.RetrainingReport;
import com.aqiforecast.domain.ValidationMetric;
import com.aqiforecast.dto.DriftSummaryResponse;
import com.aqiforecast.dto.ModelStatusResponse;
import com.aqiforecast.dto.ModelVersionResponse;
import com.aqiforecast.dto.RetrainingConfigResponse;
import com.aqiforecast.dto.RetrainingReportResponse;
import com.aqiforecast.exception.VersionNotFoundException;
import com.aqiforecast.predictor.PredictorCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the control surface: assembles per-model views from the lifecycle components.
 */
@Service
@RequiredArgsConstructor
public class ModelStatusService {

    private static final String IDLE = "IDLE";

    private final PredictorCatalog catalog;
    private final ModelVersionRegistry registry;
    private final WeightStore weightStore;
    private final PerformanceTracker performanceTracker;
    private final DriftDetector driftDetector;
    private final RetrainingTriggerEngine triggerEngine;
    private final RetrainingScheduler scheduler;
    private final RetrainingOrchestrator orchestrator;
    private final ForecastProperties properties;

    public ModelStatusResponse status(String predictorId) {
        catalog.require(predictorId);
        Optional<ModelVersionRecord> inFlight = registry.inFlight(predictorId);
        return ModelStatusResponse.builder()
            .predictorId(predictorId)
            .lifecycleState(inFlight.map(r -> r.getState().name()).orElse(IDLE))
            .activeVersion(registry.getActive(predictorId).map(ModelVersionRecord::getVersion).orElse(null))
            .currentWeight(weightStore.current().weightOf(predictorId))
            .latestPerformance(performanceTracker.latest(predictorId).orElse(null))
            .pendingTrigger(triggerEngine.pending(predictorId).orElse(null))
            .schedule(scheduler.entry(predictorId).orElse(null))
            .recentTriggers(triggerEngine.recentTriggers(predictorId))
            .build();
    }

    public List<ModelVersionResponse> history(String predictorId) {
        catalog.require(predictorId);
        return registry.history(predictorId).stream().map(ModelVersionResponse::from).toList();
    }

    public DriftSummaryResponse drift(String predictorId) {
        catalog.require(predictorId);
        return DriftSummaryResponse.from(driftDetector.compare(predictorId));
    }

    /**
     * @throws VersionNotFoundException when no version of the predictor completed validation
     */
    public ModelVersionResponse best(String predictorId, ValidationMetric metric) {
        catalog.require(predictorId);
        return registry.compare(predictorId, metric)
            .map(ModelVersionResponse::from)
            .orElseThrow(() -> new VersionNotFoundException(predictorId));
    }

    public RetrainingReportResponse report() {
        RetrainingReport report = orchestrator.report();
        return RetrainingReportResponse.builder()
            .totalRuns(report.totalRuns())
            .promoted(report.promoted())
            .rolledBack(report.rolledBack())
            .failed(report.failed())
            .successRate(report.successRate())
            .meanDurationMs(report.meanDuration().toMillis())
            .triggerTypeCounts(report.triggerTypeCounts())
            .recentOutcomes(report.recentOutcomes())
            .schedule(scheduler.entries())
            .pendingTriggers(triggerEngine.allPending())
            .build();
    }

    public RetrainingConfigResponse config() {
        ForecastProperties.Triggers triggers = properties.getTriggers();
        ForecastProperties.Drift drift = properties.getDrift();
        ForecastProperties.Retraining retraining = properties.getRetraining();
        ForecastProperties.Schedule schedule = properties.getSchedule();
        return RetrainingConfigResponse.builder()
            .rmseDegradationThreshold(triggers.getRmseDegradationThreshold())
            .accuracyDegradationThreshold(triggers.getAccuracyDegradationThreshold())
            .meanShiftThreshold(drift.getMeanShiftThreshold())
            .varianceRatioLower(drift.getVarianceRatioLower())
            .varianceRatioUpper(drift.getVarianceRatioUpper())
            .maxRmse(retraining.getMaxRmse())
            .minAccuracy(retraining.getMinAccuracy())
            .requireImprovement(retraining.isRequireImprovement())
            .maxConcurrentRetrainings(retraining.getMaxConcurrentRetrainings())
            .timeoutSeconds(retraining.getTimeout().toSeconds())
            .conflictPolicy(retraining.getConflictPolicy().name())
            .triggerCheckIntervalMinutes(triggers.getEvaluationInterval().toMinutes())
            .scheduleCheckIntervalMinutes(schedule.getCheckInterval().toMinutes())
            .minIntervalDays(schedule.getMinIntervalDays())
            .maxIntervalDays(schedule.getMaxIntervalDays())
            .schedule(scheduler.entries())
            .build();
    }
}
