package com.aqiforecast.service;

import com.aqiforecast.config.ForecastProperties;
import com.aqiforecast.domain.DriftSummary;
import com.aqiforecast.domain.PerformanceRecord;
import com.aqiforecast.domain.RetrainingTrigger;
import com.aqiforecast.domain.ScheduleEntry;
import com.aqiforecast.domain.Severity;
import com.aqiforecast.domain.TriggerType;
import com.aqiforecast.exception.InsufficientDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns drift, performance, schedule and manual conditions into retraining triggers, in that
 * priority order. Evaluation never throws for missing data: it logs and skips. All triggers go
 * through {@link PendingTriggerSlots}, which keeps at most one unconsumed trigger per predictor.
 */
@Slf4j
@Service
public class RetrainingTriggerEngine {

    private final PerformanceTracker performanceTracker;
    private final DriftDetector driftDetector;
    private final PendingTriggerSlots slots;
    private final Clock clock;
    private final double rmseDegradationThreshold;
    private final double accuracyDegradationThreshold;
    private final int baselineHistorySize;
    private final int minBaselineSnapshots;
    private final int auditTrailSize;

    private final ConcurrentHashMap<String, Deque<PerformanceRecord>> performanceHistory = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Deque<RetrainingTrigger>> auditTrail = new ConcurrentHashMap<>();

    public RetrainingTriggerEngine(PerformanceTracker performanceTracker, DriftDetector driftDetector,
                                   PendingTriggerSlots slots, ForecastProperties properties, Clock clock) {
        this.performanceTracker = performanceTracker;
        this.driftDetector = driftDetector;
        this.slots = slots;
        this.clock = clock;
        ForecastProperties.Triggers config = properties.getTriggers();
        this.rmseDegradationThreshold = config.getRmseDegradationThreshold();
        this.accuracyDegradationThreshold = config.getAccuracyDegradationThreshold();
        this.baselineHistorySize = config.getBaselineHistorySize();
        this.minBaselineSnapshots = config.getMinBaselineSnapshots();
        this.auditTrailSize = config.getAuditTrailSize();
    }

    /**
     * One evaluation cycle for a predictor: drift first, then performance degradation.
     *
     * @return the trigger created by this cycle, if any
     */
    public Optional<RetrainingTrigger> evaluate(String predictorId) {
        try {
            Optional<RetrainingTrigger> drift = checkDrift(predictorId);
            Optional<RetrainingTrigger> performance = checkPerformance(predictorId);
            return drift.or(() -> performance).flatMap(this::submit);
        } catch (RuntimeException ex) {
            log.warn("Trigger evaluation skipped | predictor={} | reason={}", predictorId, ex.getMessage(), ex);
            return Optional.empty();
        }
    }

    public List<RetrainingTrigger> evaluateAll(Collection<String> predictorIds) {
        List<RetrainingTrigger> created = new ArrayList<>();
        for (String id : predictorIds) {
            evaluate(id).ifPresent(created::add);
        }
        return created;
    }

    /**
     * Called by the scheduler once a predictor's retraining interval has elapsed.
     */
    public Optional<RetrainingTrigger> evaluateSchedule(ScheduleEntry entry) {
        Instant now = clock.instant();
        if (!entry.isDue(now)) {
            return Optional.empty();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("intervalDays", entry.intervalDays());
        details.put("lastRunAt", entry.lastRunAt() != null ? entry.lastRunAt().toString() : "never");

        if (entry.lastRunAt() == null) {
            return submit(RetrainingTrigger.create(entry.predictorId(), TriggerType.SCHEDULE, Severity.HIGH,
                "No trained version on record", details, now));
        }

        long daysSinceRun = Duration.between(entry.lastRunAt(), now).toDays();
        details.put("daysSinceRun", daysSinceRun);
        Severity severity = daysSinceRun > 2L * entry.intervalDays() ? Severity.CRITICAL : Severity.MEDIUM;
        return submit(RetrainingTrigger.create(entry.predictorId(), TriggerType.SCHEDULE, severity,
            "Scheduled retraining due after " + daysSinceRun + " days (interval " + entry.intervalDays() + ")",
            details, now));
    }

    public PendingTriggerSlots.Offer requestManual(String predictorId, String reason, Severity severity) {
        Severity effective = severity != null ? severity : Severity.LOW;
        RetrainingTrigger trigger = RetrainingTrigger.create(predictorId, TriggerType.MANUAL, effective,
            reason != null && !reason.isBlank() ? reason : "Manual retraining request",
            Map.of("manual", true), clock.instant());
        PendingTriggerSlots.Offer offer = slots.offer(trigger);
        logOffer(offer, trigger);
        return offer;
    }

    public Optional<RetrainingTrigger> pending(String predictorId) {
        return slots.pending(predictorId);
    }

    public Map<String, RetrainingTrigger> allPending() {
        return slots.allPending();
    }

    /**
     * Consumes the pending trigger of a predictor. Each trigger is handed out at most once.
     */
    public Optional<RetrainingTrigger> claim(String predictorId) {
        Optional<RetrainingTrigger> claimed = slots.claim(predictorId, clock.instant());
        claimed.ifPresent(this::recordAudit);
        return claimed;
    }

    public Optional<RetrainingTrigger> claim(String predictorId, UUID triggerId) {
        Optional<RetrainingTrigger> claimed = slots.claim(predictorId, triggerId, clock.instant());
        claimed.ifPresent(this::recordAudit);
        return claimed;
    }

    public List<RetrainingTrigger> recentTriggers(String predictorId) {
        Deque<RetrainingTrigger> trail = auditTrail.get(predictorId);
        if (trail == null) {
            return List.of();
        }
        synchronized (trail) {
            return List.copyOf(trail);
        }
    }

    /**
     * Forgets the historical performance of a predictor; its next snapshots form a new baseline.
     */
    public void resetPerformanceBaseline(String predictorId) {
        performanceHistory.remove(predictorId);
    }

    private Optional<RetrainingTrigger> checkDrift(String predictorId) {
        DriftSummary summary;
        try {
            summary = driftDetector.compare(predictorId);
        } catch (InsufficientDataException ex) {
            log.debug("Drift check skipped | predictor={} | reason={}", predictorId, ex.getMessage());
            return Optional.empty();
        }
        if (!summary.driftDetected()) {
            return Optional.empty();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("feature", summary.dominantFeature());
        details.put("meanShift", summary.meanShift());
        details.put("varianceRatio", summary.varianceRatio());
        details.put("baselineMean", summary.baselineMean());
        details.put("recentMean", summary.recentMean());
        return Optional.of(RetrainingTrigger.create(predictorId, TriggerType.DRIFT, Severity.CRITICAL,
            String.format("Input drift on '%s': mean shift %.3f, variance ratio %.3f",
                summary.dominantFeature(), summary.meanShift(), summary.varianceRatio()),
            details, clock.instant()));
    }

    private Optional<RetrainingTrigger> checkPerformance(String predictorId) {
        PerformanceRecord current;
        try {
            current = performanceTracker.snapshot(predictorId);
        } catch (InsufficientDataException ex) {
            log.debug("Performance check skipped | predictor={} | reason={}", predictorId, ex.getMessage());
            return Optional.empty();
        }

        Deque<PerformanceRecord> history = performanceHistory.computeIfAbsent(predictorId, id -> new ArrayDeque<>());
        Optional<RetrainingTrigger> trigger = Optional.empty();
        synchronized (history) {
            if (history.size() >= minBaselineSnapshots) {
                double baselineRmse = history.stream().mapToDouble(PerformanceRecord::rmse).average().orElse(0.0);
                double baselineAccuracy = history.stream().mapToDouble(PerformanceRecord::accuracyWithinThreshold).average().orElse(0.0);
                trigger = degradation(predictorId, current, baselineRmse, baselineAccuracy);
            }
            history.addLast(current);
            while (history.size() > baselineHistorySize) {
                history.removeFirst();
            }
        }
        return trigger;
    }

    private Optional<RetrainingTrigger> degradation(String predictorId, PerformanceRecord current,
                                                    double baselineRmse, double baselineAccuracy) {
        double rmseDegradation = baselineRmse > 0.0d ? (current.rmse() - baselineRmse) / baselineRmse : 0.0d;
        double accuracyDegradation = baselineAccuracy > 0.0d
            ? (baselineAccuracy - current.accuracyWithinThreshold()) / baselineAccuracy : 0.0d;

        Severity rmseSeverity = severityOf(rmseDegradation, rmseDegradationThreshold);
        Severity accuracySeverity = severityOf(accuracyDegradation, accuracyDegradationThreshold);
        if (rmseSeverity == null && accuracySeverity == null) {
            return Optional.empty();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recentRmse", current.rmse());
        details.put("historicalRmse", baselineRmse);
        details.put("rmseDegradation", rmseDegradation);
        details.put("recentAccuracy", current.accuracyWithinThreshold());
        details.put("historicalAccuracy", baselineAccuracy);
        details.put("accuracyDegradation", accuracyDegradation);

        boolean rmseDominates = rmseSeverity != null
            && (accuracySeverity == null || rmseSeverity.isAtLeast(accuracySeverity));
        Severity severity = rmseDominates ? rmseSeverity : accuracySeverity;
        String reason = rmseDominates
            ? String.format("RMSE degraded by %.1f%% (%.3f vs baseline %.3f)",
                rmseDegradation * 100, current.rmse(), baselineRmse)
            : String.format("Accuracy degraded by %.1f%% (%.3f vs baseline %.3f)",
                accuracyDegradation * 100, current.accuracyWithinThreshold(), baselineAccuracy);

        return Optional.of(RetrainingTrigger.create(predictorId, TriggerType.PERFORMANCE, severity, reason,
            details, clock.instant()));
    }

    private static Severity severityOf(double degradation, double threshold) {
        if (degradation <= threshold) {
            return null;
        }
        return degradation > 2 * threshold ? Severity.CRITICAL : Severity.HIGH;
    }

    private Optional<RetrainingTrigger> submit(RetrainingTrigger candidate) {
        PendingTriggerSlots.Offer offer = slots.offer(candidate);
        logOffer(offer, candidate);
        return offer.created() ? Optional.of(candidate) : Optional.empty();
    }

    private void logOffer(PendingTriggerSlots.Offer offer, RetrainingTrigger candidate) {
        switch (offer.status()) {
            case ACCEPTED -> log.info("Retraining trigger created | predictor={} | id={} | type={} | severity={} | reason={}",
                candidate.getPredictorId(), candidate.getId(), candidate.getType(), candidate.getSeverity(), candidate.getReason());
            case REPLACED -> log.info("Retraining trigger escalated | predictor={} | id={} | type={} | severity={} | replaced={} ({})",
                candidate.getPredictorId(), candidate.getId(), candidate.getType(), candidate.getSeverity(),
                offer.replaced().getId(), offer.replaced().getSeverity());
            case DEDUPLICATED -> log.debug("Retraining trigger deduplicated | predictor={} | type={} | severity={} | pending={} ({})",
                candidate.getPredictorId(), candidate.getType(), candidate.getSeverity(),
                offer.pending().getId(), offer.pending().getSeverity());
        }
        if (offer.created()) {
            recordAudit(candidate);
        }
    }

    private void recordAudit(RetrainingTrigger trigger) {
        Deque<RetrainingTrigger> trail = auditTrail.computeIfAbsent(trigger.getPredictorId(), id -> new ArrayDeque<>());
        synchronized (trail) {
            trail.removeIf(t -> t.getId().equals(trigger.getId()));
            trail.addLast(trigger);
            while (trail.size() > auditTrailSize) {
                trail.removeFirst();
            }
        }
    }
}
