package com.aqiforecast.service;

import com.aqiforecast.domain.ModelVersionRecord;
import com.aqiforecast.domain.ModelVersionState;
import com.aqiforecast.domain.ValidationMetric;
import com.aqiforecast.domain.ValidationMetrics;
import com.aqiforecast.exception.ConcurrencyConflictException;
import com.aqiforecast.exception.IllegalStateTransitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Version history of every predictor with an enforced lifecycle. Mutations of one predictor's
 * history are serialized; the active Production record is published through an atomic reference
 * so readers never wait on a running promotion.
 */
@Slf4j
@Service
public class ModelVersionRegistry {

    private static final Set<ModelVersionState> COMPARABLE =
        EnumSet.of(ModelVersionState.PROMOTED, ModelVersionState.ARCHIVED, ModelVersionState.ROLLED_BACK);

    private final Clock clock;
    private final ConcurrentHashMap<String, History> histories = new ConcurrentHashMap<>();

    public ModelVersionRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates a TRIGGERED record for a new retraining run.
     *
     * @throws ConcurrencyConflictException if the predictor already has a run in flight
     */
    public ModelVersionRecord open(String predictorId, UUID triggerId) {
        History history = historyOf(predictorId);
        synchronized (history) {
            Optional<ModelVersionRecord> running = history.inFlight();
            if (running.isPresent()) {
                throw new ConcurrencyConflictException(predictorId, null);
            }
            Instant now = clock.instant();
            ModelVersionRecord record = ModelVersionRecord.builder()
                .recordId(UUID.randomUUID())
                .predictorId(predictorId)
                .state(ModelVersionState.TRIGGERED)
                .createdAt(now)
                .updatedAt(now)
                .triggerId(triggerId)
                .build();
            history.records.add(record);
            return record;
        }
    }

    public ModelVersionRecord transition(String predictorId, UUID recordId, ModelVersionState target) {
        return transition(predictorId, recordId, target, UnaryOperator.identity());
    }

    /**
     * @param update applied to the record together with the state change
     * @throws IllegalStateTransitionException when the lifecycle does not allow the move
     */
    public ModelVersionRecord transition(String predictorId, UUID recordId, ModelVersionState target,
                                         UnaryOperator<ModelVersionRecord> update) {
        History history = historyOf(predictorId);
        synchronized (history) {
            int index = history.indexOf(recordId);
            ModelVersionRecord current = history.records.get(index);
            if (target == ModelVersionState.PROMOTED || !current.getState().canTransitionTo(target)) {
                throw new IllegalStateTransitionException(predictorId, current.getState(), target);
            }
            ModelVersionRecord updated = update.apply(current).toBuilder()
                .state(target)
                .updatedAt(clock.instant())
                .build();
            history.records.set(index, updated);
            log.debug("Model version transition | predictor={} | record={} | {} -> {}",
                predictorId, recordId, current.getState(), target);
            return updated;
        }
    }

    /**
     * Like {@link #transition} but returns empty instead of throwing when the record has already
     * moved to a state that does not allow the target, e.g. after a concurrent timeout.
     */
    public Optional<ModelVersionRecord> tryTransition(String predictorId, UUID recordId, ModelVersionState target,
                                                      UnaryOperator<ModelVersionRecord> update) {
        History history = historyOf(predictorId);
        synchronized (history) {
            ModelVersionRecord current = history.records.get(history.indexOf(recordId));
            if (target == ModelVersionState.PROMOTED || !current.getState().canTransitionTo(target)) {
                return Optional.empty();
            }
            return Optional.of(transition(predictorId, recordId, target, update));
        }
    }

    /**
     * Promotes a validated record and archives the previous Production record in one step.
     */
    public ModelVersionRecord promote(String predictorId, UUID recordId, ValidationMetrics metrics) {
        History history = historyOf(predictorId);
        synchronized (history) {
            int index = history.indexOf(recordId);
            ModelVersionRecord candidate = history.records.get(index);
            if (!candidate.getState().canTransitionTo(ModelVersionState.PROMOTED)) {
                throw new IllegalStateTransitionException(predictorId, candidate.getState(), ModelVersionState.PROMOTED);
            }
            Instant now = clock.instant();
            ModelVersionRecord previous = history.active.get();
            if (previous != null) {
                int previousIndex = history.indexOf(previous.getRecordId());
                history.records.set(previousIndex, history.records.get(previousIndex).toBuilder()
                    .state(ModelVersionState.ARCHIVED)
                    .updatedAt(now)
                    .build());
            }
            ModelVersionRecord promoted = candidate.toBuilder()
                .state(ModelVersionState.PROMOTED)
                .metrics(metrics != null ? metrics : candidate.getMetrics())
                .updatedAt(now)
                .promotedAt(now)
                .build();
            history.records.set(index, promoted);
            history.active.set(promoted);
            log.info("Model version promoted | predictor={} | version={} | archived={}",
                predictorId, promoted.getVersion(), previous != null ? previous.getVersion() : "none");
            return promoted;
        }
    }

    /**
     * Registers a Production version that already exists in the model store. Ignored when the
     * predictor has an active version.
     */
    public Optional<ModelVersionRecord> seed(String predictorId, String version, ValidationMetrics metrics,
                                             Instant promotedAt) {
        History history = historyOf(predictorId);
        synchronized (history) {
            if (history.active.get() != null) {
                return Optional.empty();
            }
            Instant at = promotedAt != null ? promotedAt : clock.instant();
            ModelVersionRecord record = ModelVersionRecord.builder()
                .recordId(UUID.randomUUID())
                .predictorId(predictorId)
                .version(version)
                .state(ModelVersionState.PROMOTED)
                .metrics(metrics)
                .createdAt(at)
                .updatedAt(at)
                .promotedAt(at)
                .build();
            history.records.add(record);
            history.active.set(record);
            log.info("Model version seeded | predictor={} | version={}", predictorId, version);
            return Optional.of(record);
        }
    }

    public Optional<ModelVersionRecord> getActive(String predictorId) {
        History history = histories.get(predictorId);
        return history == null ? Optional.empty() : Optional.ofNullable(history.active.get());
    }

    public Optional<ModelVersionRecord> inFlight(String predictorId) {
        History history = histories.get(predictorId);
        if (history == null) {
            return Optional.empty();
        }
        synchronized (history) {
            return history.inFlight();
        }
    }

    public Optional<ModelVersionRecord> find(String predictorId, UUID recordId) {
        return history(predictorId).stream().filter(r -> r.getRecordId().equals(recordId)).findFirst();
    }

    /**
     * All records of a predictor in creation order.
     */
    public List<ModelVersionRecord> history(String predictorId) {
        History history = histories.get(predictorId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return List.copyOf(history.records);
        }
    }

    /**
     * Best version by the given metric among records that completed validation. Failed runs
     * are not candidates.
     */
    public Optional<ModelVersionRecord> compare(String predictorId, ValidationMetric metric) {
        Comparator<ModelVersionRecord> byMetric = Comparator.comparingDouble(r -> metric.valueOf(r.getMetrics()));
        if (!metric.lowerIsBetter()) {
            byMetric = byMetric.reversed();
        }
        return history(predictorId).stream()
            .filter(r -> r.getMetrics() != null && r.getVersion() != null && COMPARABLE.contains(r.getState()))
            .filter(r -> Double.isFinite(metric.valueOf(r.getMetrics())))
            .min(byMetric);
    }

    private History historyOf(String predictorId) {
        return histories.computeIfAbsent(predictorId, id -> new History());
    }

    private static final class History {
        private final List<ModelVersionRecord> records = new ArrayList<>();
        private final AtomicReference<ModelVersionRecord> active = new AtomicReference<>();

        private Optional<ModelVersionRecord> inFlight() {
            return records.stream().filter(r -> r.getState().isInFlight()).findFirst();
        }

        private int indexOf(UUID recordId) {
            for (int i = 0; i < records.size(); i++) {
                if (records.get(i).getRecordId().equals(recordId)) {
                    return i;
                }
            }
            throw new NoSuchElementException("Unknown model version record " + recordId);
        }
    }
}
