package com.aqiforecast.service;

import com.aqiforecast.config.ForecastProperties;
import com.aqiforecast.domain.ModelVersionRecord;
import com.aqiforecast.domain.ModelVersionState;
import com.aqiforecast.domain.RetrainingOutcome;
import com.aqiforecast.domain.RetrainingReport;
import com.aqiforecast.domain.RetrainingTrigger;
import com.aqiforecast.domain.Severity;
import com.aqiforecast.domain.TriggerCheck;
import com.aqiforecast.domain.TriggerType;
import com.aqiforecast.domain.ValidationMetrics;
import com.aqiforecast.exception.ConcurrencyConflictException;
import com.aqiforecast.exception.PersistenceException;
import com.aqiforecast.exception.QualityGateException;
import com.aqiforecast.exception.RetrainingTimeoutException;
import com.aqiforecast.exception.UnknownModelException;
import com.aqiforecast.predictor.HoldoutWindow;
import com.aqiforecast.predictor.Predictor;
import com.aqiforecast.predictor.PredictorCatalog;
import com.aqiforecast.predictor.TrainingRequest;
import com.aqiforecast.predictor.TrainingResult;
import com.aqiforecast.store.ModelRunStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives retraining runs from trigger to terminal state.
 * <p>
 * A predictor holds the in-flight slot from the moment its trigger is claimed until the run's
 * outcome is recorded. Runs execute on a dedicated bounded pool; a watchdog enforces the hard
 * timeout. Exactly one of the worker and the watchdog finishes a run.
 */
@Slf4j
@Service
public class RetrainingOrchestrator {

    private final PredictorCatalog catalog;
    private final ModelVersionRegistry registry;
    private final RetrainingTriggerEngine triggerEngine;
    private final RetrainingScheduler scheduler;
    private final DriftDetector driftDetector;
    private final PerformanceTracker performanceTracker;
    private final WeightStore weightStore;
    private final ModelRunStore modelRunStore;
    private final ForecastProperties.Retraining config;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Deque<RetrainingOutcome> outcomes = new ArrayDeque<>();

    private ExecutorService executor;
    private ScheduledExecutorService watchdog;

    public RetrainingOrchestrator(PredictorCatalog catalog,
                                  ModelVersionRegistry registry,
                                  RetrainingTriggerEngine triggerEngine,
                                  RetrainingScheduler scheduler,
                                  DriftDetector driftDetector,
                                  PerformanceTracker performanceTracker,
                                  WeightStore weightStore,
                                  ModelRunStore modelRunStore,
                                  ForecastProperties properties,
                                  Clock clock) {
        this.catalog = catalog;
        this.registry = registry;
        this.triggerEngine = triggerEngine;
        this.scheduler = scheduler;
        this.driftDetector = driftDetector;
        this.performanceTracker = performanceTracker;
        this.weightStore = weightStore;
        this.modelRunStore = modelRunStore;
        this.config = properties.getRetraining();
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(config.getMaxConcurrentRetrainings(),
            new CustomizableThreadFactory("retraining-"));
        watchdog = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("retraining-watchdog-"));
        log.info("Retraining orchestrator started | maxConcurrent={} | timeout={} | conflictPolicy={}",
            config.getMaxConcurrentRetrainings(), config.getTimeout(), config.getConflictPolicy());
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
        if (watchdog != null) {
            watchdog.shutdownNow();
        }
    }

    /**
     * Starts a run for every predictor that has a pending trigger and no run in flight.
     */
    public List<CompletableFuture<RetrainingOutcome>> dispatchPending() {
        List<CompletableFuture<RetrainingOutcome>> started = new ArrayList<>();
        for (String predictorId : triggerEngine.allPending().keySet()) {
            dispatch(predictorId).ifPresent(started::add);
        }
        return started;
    }

    /**
     * Evaluates drift and performance for every idle predictor, fires due schedules, then starts
     * whatever is pending. Does not wait for the started runs.
     */
    public TriggerCheck checkTriggers() {
        List<String> idle = catalog.ids().stream()
            .filter(id -> !isRetraining(id))
            .toList();
        List<RetrainingTrigger> created = new ArrayList<>(triggerEngine.evaluateAll(idle));
        created.addAll(scheduler.tick());
        int started = dispatchPending().size();
        log.info("Trigger check | evaluated={} | created={} | started={}", idle.size(), created.size(), started);
        return new TriggerCheck(created, started, clock.instant());
    }

    public Optional<CompletableFuture<RetrainingOutcome>> dispatch(String predictorId) {
        if (!inFlight.add(predictorId)) {
            onConflict(predictorId);
            return Optional.empty();
        }
        Optional<RetrainingTrigger> claimed;
        try {
            claimed = triggerEngine.claim(predictorId);
        } catch (RuntimeException ex) {
            inFlight.remove(predictorId);
            throw ex;
        }
        if (claimed.isEmpty()) {
            inFlight.remove(predictorId);
            return Optional.empty();
        }
        try {
            return Optional.of(start(claimed.get()));
        } catch (ConcurrencyConflictException | UnknownModelException ex) {
            log.warn("Retraining trigger discarded | predictor={} | trigger={} | reason={}",
                predictorId, claimed.get().getId(), ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Runs an already claimed trigger.
     *
     * @throws ConcurrencyConflictException when the predictor already has a run in flight
     * @throws UnknownModelException        when no such predictor is registered
     */
    public CompletableFuture<RetrainingOutcome> submit(RetrainingTrigger trigger) {
        String predictorId = trigger.getPredictorId();
        catalog.require(predictorId);
        if (!inFlight.add(predictorId)) {
            log.warn("Retraining submission rejected | predictor={} | trigger={} | reason=retraining already in flight",
                predictorId, trigger.getId());
            throw new ConcurrencyConflictException(predictorId, null);
        }
        return start(trigger);
    }

    /**
     * Creates a manual trigger and starts it when the predictor is idle. With the queue policy a
     * request against a busy predictor leaves its trigger pending and still reports the conflict.
     */
    public PendingTriggerSlots.Offer requestRetrain(String predictorId, String reason, Severity severity) {
        catalog.require(predictorId);
        boolean busy = isRetraining(predictorId);
        if (busy && config.getConflictPolicy() == ForecastProperties.ConflictPolicy.REJECT) {
            log.warn("Manual retraining rejected | predictor={} | reason=retraining already in flight", predictorId);
            throw new ConcurrencyConflictException(predictorId, null);
        }
        PendingTriggerSlots.Offer offer = triggerEngine.requestManual(predictorId, reason, severity);
        if (busy) {
            throw new ConcurrencyConflictException(predictorId, offer.pending().getId());
        }
        dispatch(predictorId);
        return offer;
    }

    /**
     * Offers a manual trigger and runs whichever trigger then holds the predictor's slot, so a
     * pending trigger of higher severity absorbs the request instead of running after it.
     *
     * @throws ConcurrencyConflictException when the predictor already has a run in flight
     * @throws UnknownModelException        when no such predictor is registered
     */
    public CompletableFuture<RetrainingOutcome> retrainNow(String predictorId, String reason, Severity severity) {
        catalog.require(predictorId);
        if (!inFlight.add(predictorId)) {
            throw new ConcurrencyConflictException(predictorId, null);
        }
        Optional<RetrainingTrigger> claimed;
        try {
            PendingTriggerSlots.Offer offer = triggerEngine.requestManual(predictorId, reason, severity);
            claimed = triggerEngine.claim(predictorId, offer.pending().getId())
                .or(() -> triggerEngine.claim(predictorId));
        } catch (RuntimeException ex) {
            inFlight.remove(predictorId);
            throw ex;
        }
        if (claimed.isEmpty()) {
            inFlight.remove(predictorId);
            throw new ConcurrencyConflictException(predictorId, null);
        }
        return start(claimed.get());
    }

    public boolean isRetraining(String predictorId) {
        return inFlight.contains(predictorId) || registry.inFlight(predictorId).isPresent();
    }

    public List<RetrainingOutcome> recentOutcomes() {
        synchronized (outcomes) {
            return List.copyOf(outcomes);
        }
    }

    public RetrainingReport report() {
        List<RetrainingOutcome> recent = recentOutcomes();
        int promoted = 0;
        int rolledBack = 0;
        int failed = 0;
        Duration total = Duration.ZERO;
        Map<TriggerType, Long> byType = new EnumMap<>(TriggerType.class);
        for (RetrainingOutcome outcome : recent) {
            switch (outcome.finalState()) {
                case PROMOTED -> promoted++;
                case ROLLED_BACK -> rolledBack++;
                default -> failed++;
            }
            total = total.plus(outcome.duration());
            if (outcome.triggerType() != null) {
                byType.merge(outcome.triggerType(), 1L, Long::sum);
            }
        }
        int runs = recent.size();
        return new RetrainingReport(
            runs,
            promoted,
            rolledBack,
            failed,
            runs == 0 ? 0.0d : (double) promoted / runs,
            runs == 0 ? Duration.ZERO : total.dividedBy(runs),
            byType,
            recent);
    }

    private CompletableFuture<RetrainingOutcome> start(RetrainingTrigger trigger) {
        String predictorId = trigger.getPredictorId();
        Predictor predictor;
        ModelVersionRecord record;
        try {
            predictor = catalog.require(predictorId);
            record = registry.open(predictorId, trigger.getId());
        } catch (RuntimeException ex) {
            inFlight.remove(predictorId);
            throw ex;
        }

        Run run = new Run(trigger, record.getRecordId(), predictor, clock.instant());
        FutureTask<Void> task = new FutureTask<>(() -> execute(run), null);
        run.task = task;
        try {
            executor.execute(task);
        } catch (RejectedExecutionException ex) {
            if (run.complete()) {
                finish(run, ModelVersionState.FAILED, null, null, "Retraining executor rejected the run");
            }
            return run.result;
        }
        log.info("Retraining queued | predictor={} | record={} | trigger={} | type={} | severity={}",
            predictorId, run.recordId, trigger.getId(), trigger.getType(), trigger.getSeverity());
        return run.result;
    }

    private void execute(Run run) {
        String predictorId = run.predictorId();
        Instant startedAt = clock.instant();
        run.startedAt = startedAt;
        try {
            run.timeout = watchdog.schedule(() -> onTimeout(run), config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            log.warn("Retraining watchdog unavailable | predictor={} | reason={}", predictorId, ex.toString());
        }

        String version = null;
        ValidationMetrics metrics = null;
        boolean committed = false;
        try {
            registry.transition(predictorId, run.recordId, ModelVersionState.RUNNING);
            scheduler.recordRun(predictorId, startedAt);
            log.info("Retraining started | predictor={} | record={} | trigger={} | type={}",
                predictorId, run.recordId, run.trigger.getId(), run.trigger.getType());

            TrainingResult trained = run.predictor.train(new TrainingRequest(
                predictorId, run.trigger.getId(), startedAt.minus(config.getTrainingWindow()), startedAt,
                run.cancellation));
            if (run.isCompleted()) {
                return;
            }
            version = trained.version();
            String candidate = version;
            registry.transition(predictorId, run.recordId, ModelVersionState.VALIDATING,
                r -> r.toBuilder().version(candidate).build());

            Instant holdoutEnd = clock.instant();
            metrics = run.predictor.validate(version,
                new HoldoutWindow(holdoutEnd.minus(config.getValidationWindow()), holdoutEnd));
            if (run.isCompleted()) {
                return;
            }
            checkQualityGates(metrics);

            Optional<String> regression = regressionAgainstActive(predictorId, metrics);
            if (regression.isPresent()) {
                if (run.complete()) {
                    run.disarm();
                    finish(run, ModelVersionState.ROLLED_BACK, version, metrics, regression.get());
                }
                return;
            }

            if (!run.complete()) {
                return;
            }
            committed = true;
            run.disarm();
            modelRunStore.promote(predictorId, version, config.getProductionStage());
            registry.promote(predictorId, run.recordId, metrics);
            afterPromotion(predictorId);
            finish(run, ModelVersionState.PROMOTED, version, metrics, null);
        } catch (RuntimeException ex) {
            if (committed || run.complete()) {
                run.disarm();
                if (ex instanceof QualityGateException || ex instanceof PersistenceException) {
                    log.warn("Retraining rejected | predictor={} | version={} | reason={}", predictorId, version, ex.getMessage());
                } else {
                    log.error("Retraining failed | predictor={} | version={}", predictorId, version, ex);
                }
                finish(run, ModelVersionState.FAILED, version, metrics, ex.getMessage());
            } else {
                log.debug("Retraining worker ended after timeout | predictor={} | reason={}", predictorId, ex.toString());
            }
        }
    }

    private void onTimeout(Run run) {
        if (!run.complete()) {
            return;
        }
        run.cancellation.set(true);
        FutureTask<Void> task = run.task;
        if (task != null) {
            task.cancel(true);
        }
        RetrainingTimeoutException timeout = new RetrainingTimeoutException(run.predictorId(), config.getTimeout());
        log.warn("Retraining timed out | predictor={} | record={} | timeout={}", run.predictorId(), run.recordId, config.getTimeout());
        finish(run, ModelVersionState.FAILED, null, null, timeout.getMessage());
    }

    private void checkQualityGates(ValidationMetrics metrics) {
        if (metrics == null) {
            throw new QualityGateException("Validation returned no metrics");
        }
        if (!(metrics.rmse() <= config.getMaxRmse())) {
            throw new QualityGateException(String.format(
                "RMSE %.3f exceeds the maximum of %.3f", metrics.rmse(), config.getMaxRmse()));
        }
        if (!(metrics.accuracyWithinThreshold() >= config.getMinAccuracy())) {
            throw new QualityGateException(String.format(
                "Accuracy %.3f is below the minimum of %.3f", metrics.accuracyWithinThreshold(), config.getMinAccuracy()));
        }
    }

    private Optional<String> regressionAgainstActive(String predictorId, ValidationMetrics candidate) {
        if (!config.isRequireImprovement()) {
            return Optional.empty();
        }
        return registry.getActive(predictorId)
            .filter(active -> active.getMetrics() != null && Double.isFinite(active.getMetrics().rmse()))
            .filter(active -> candidate.rmse() > active.getMetrics().rmse())
            .map(active -> String.format("Candidate RMSE %.3f is worse than active version %s (%.3f)",
                candidate.rmse(), active.getVersion(), active.getMetrics().rmse()));
    }

    private void afterPromotion(String predictorId) {
        try {
            driftDetector.resetBaseline(predictorId);
            performanceTracker.reset(predictorId);
            triggerEngine.resetPerformanceBaseline(predictorId);
            weightStore.refresh();
        } catch (RuntimeException ex) {
            log.error("Post-promotion reset incomplete | predictor={}", predictorId, ex);
        }
    }

    private void finish(Run run, ModelVersionState target, String version, ValidationMetrics metrics, String reason) {
        String predictorId = run.predictorId();
        RetrainingOutcome outcome = null;
        RuntimeException failure = null;
        try {
            ModelVersionRecord record = target == ModelVersionState.PROMOTED
                ? registry.find(predictorId, run.recordId).orElse(null)
                : registry.tryTransition(predictorId, run.recordId, target, r -> r.toBuilder()
                        .version(version != null ? version : r.getVersion())
                        .metrics(metrics)
                        .failureReason(reason)
                        .build())
                    .orElseGet(() -> registry.find(predictorId, run.recordId).orElse(null));

            Instant finishedAt = clock.instant();
            Instant startedAt = run.startedAt != null ? run.startedAt : run.openedAt;
            outcome = new RetrainingOutcome(
                predictorId,
                run.recordId,
                run.trigger.getId(),
                run.trigger.getType(),
                run.trigger.getSeverity(),
                record != null ? record.getState() : target,
                record != null ? record.getVersion() : version,
                metrics,
                Duration.between(startedAt, finishedAt),
                reason);

            remember(outcome);
            log.info("Retraining outcome | predictor={} | state={} | version={} | trigger={} | type={} | severity={} | triggerReason={} | durationMs={} | metrics={} | failure={}",
                predictorId, outcome.finalState(), outcome.version(), run.trigger.getId(), run.trigger.getType(),
                run.trigger.getSeverity(), run.trigger.getReason(), outcome.duration().toMillis(),
                metrics != null ? metrics.asMap() : Map.of(), reason);
            saveRun(outcome);
            if (metrics != null) {
                scheduler.recordOutcome(predictorId, scheduler.validationScore(metrics), finishedAt);
            } else {
                scheduler.recordRun(predictorId, finishedAt);
            }
        } catch (RuntimeException ex) {
            log.error("Retraining outcome could not be recorded | predictor={} | record={}", predictorId, run.recordId, ex);
            failure = ex;
        } finally {
            inFlight.remove(predictorId);
        }

        discardStaleTriggers(run, target == ModelVersionState.PROMOTED);
        if (outcome != null) {
            run.result.complete(outcome);
        } else {
            run.result.completeExceptionally(failure);
        }
        dispatchNext();
    }

    /**
     * Drops triggers raised while the run was in flight that the run has made obsolete: schedule
     * triggers always, drift and performance triggers once a new version is promoted. Manual
     * requests are kept.
     */
    private void discardStaleTriggers(Run run, boolean promoted) {
        String predictorId = run.predictorId();
        try {
            Instant now = clock.instant();
            triggerEngine.pending(predictorId)
                .filter(t -> t.getType() == TriggerType.SCHEDULE || (promoted && t.getType() != TriggerType.MANUAL))
                .filter(t -> !t.getCreatedAt().isAfter(now))
                .flatMap(t -> triggerEngine.claim(predictorId, t.getId()))
                .ifPresent(t -> log.info(
                    "Retraining trigger discarded | predictor={} | trigger={} | type={} | severity={} | reason=raised during run {}",
                    predictorId, t.getId(), t.getType(), t.getSeverity(), run.recordId));
        } catch (RuntimeException ex) {
            log.error("Stale trigger cleanup failed | predictor={}", predictorId, ex);
        }
    }

    private void saveRun(RetrainingOutcome outcome) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(ModelRunStore.PARAM_PREDICTOR_ID, outcome.predictorId());
        params.put(ModelRunStore.PARAM_VERSION, outcome.version());
        params.put("record_id", outcome.recordId());
        params.put("trigger_id", outcome.triggerId());
        params.put("trigger_type", outcome.triggerType());
        params.put("severity", outcome.severity());
        params.put("final_state", outcome.finalState());
        params.put("duration_ms", outcome.duration().toMillis());
        params.put("failure_reason", outcome.failureReason());

        Map<String, String> artifacts = outcome.version() == null
            ? Map.of()
            : Map.of("model_uri", "models:/" + outcome.predictorId() + "/" + outcome.version());
        try {
            String runId = modelRunStore.saveRun(params,
                outcome.metrics() != null ? outcome.metrics().asMap() : Map.of(), artifacts);
            log.debug("Retraining run stored | predictor={} | run={}", outcome.predictorId(), runId);
        } catch (PersistenceException ex) {
            log.error("Retraining run could not be stored | predictor={} | record={}",
                outcome.predictorId(), outcome.recordId(), ex);
        }
    }

    private void remember(RetrainingOutcome outcome) {
        synchronized (outcomes) {
            outcomes.addLast(outcome);
            while (outcomes.size() > config.getOutcomeHistorySize()) {
                outcomes.removeFirst();
            }
        }
    }

    private void dispatchNext() {
        try {
            dispatchPending();
        } catch (RuntimeException ex) {
            log.error("Dispatch of pending retraining triggers failed", ex);
        }
    }

    private void onConflict(String predictorId) {
        if (config.getConflictPolicy() == ForecastProperties.ConflictPolicy.REJECT) {
            triggerEngine.claim(predictorId).ifPresent(t -> log.warn(
                "Retraining trigger rejected | predictor={} | trigger={} | type={} | severity={} | reason=retraining already in flight",
                predictorId, t.getId(), t.getType(), t.getSeverity()));
        } else {
            triggerEngine.pending(predictorId).ifPresent(t -> log.debug(
                "Retraining trigger queued | predictor={} | trigger={} | type={} | severity={}",
                predictorId, t.getId(), t.getType(), t.getSeverity()));
        }
    }

    private static final class Run {
        private final RetrainingTrigger trigger;
        private final UUID recordId;
        private final Predictor predictor;
        private final Instant openedAt;
        private final AtomicBoolean cancellation = new AtomicBoolean();
        private final AtomicBoolean completed = new AtomicBoolean();
        private final CompletableFuture<RetrainingOutcome> result = new CompletableFuture<>();
        private volatile FutureTask<Void> task;
        private volatile ScheduledFuture<?> timeout;
        private volatile Instant startedAt;

        private Run(RetrainingTrigger trigger, UUID recordId, Predictor predictor, Instant openedAt) {
            this.trigger = trigger;
            this.recordId = recordId;
            this.predictor = predictor;
            this.openedAt = openedAt;
        }

        private String predictorId() {
            return trigger.getPredictorId();
        }

        /**
         * Claims the right to finish this run; true for exactly one caller.
         */
        private boolean complete() {
            return completed.compareAndSet(false, true);
        }

        private boolean isCompleted() {
            return completed.get();
        }

        private void disarm() {
            ScheduledFuture<?> scheduled = timeout;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
