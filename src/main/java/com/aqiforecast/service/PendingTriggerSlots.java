package com.aqiforecast.service;

import com.aqiforecast.domain.RetrainingTrigger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One pending-trigger slot per predictor. Offers and claims are compare-and-swap on the slot,
 * so concurrent detectors can never leave two unconsumed triggers for the same predictor.
 */
@Component
public class PendingTriggerSlots {

    public enum OfferStatus {
        ACCEPTED,
        REPLACED,
        DEDUPLICATED
    }

    /**
     * @param pending  the trigger left in the slot after the offer
     * @param replaced the trigger evicted by a higher-severity offer, if any
     */
    public record Offer(OfferStatus status, RetrainingTrigger pending, RetrainingTrigger replaced) {
        public boolean created() {
            return status != OfferStatus.DEDUPLICATED;
        }
    }

    private final ConcurrentHashMap<String, AtomicReference<RetrainingTrigger>> slots = new ConcurrentHashMap<>();

    public Offer offer(RetrainingTrigger candidate) {
        AtomicReference<RetrainingTrigger> slot = slot(candidate.getPredictorId());
        while (true) {
            RetrainingTrigger existing = slot.get();
            if (existing != null && !candidate.getSeverity().isHigherThan(existing.getSeverity())) {
                return new Offer(OfferStatus.DEDUPLICATED, existing, null);
            }
            if (slot.compareAndSet(existing, candidate)) {
                return existing == null
                    ? new Offer(OfferStatus.ACCEPTED, candidate, null)
                    : new Offer(OfferStatus.REPLACED, candidate, existing);
            }
        }
    }

    /**
     * Empties the slot and returns its trigger stamped as consumed.
     */
    public Optional<RetrainingTrigger> claim(String predictorId, Instant now) {
        AtomicReference<RetrainingTrigger> slot = slots.get(predictorId);
        if (slot == null) {
            return Optional.empty();
        }
        RetrainingTrigger claimed = slot.getAndSet(null);
        return Optional.ofNullable(claimed).map(t -> t.consumed(now));
    }

    /**
     * Consumes the given trigger only if it is still the pending one.
     */
    public Optional<RetrainingTrigger> claim(String predictorId, UUID triggerId, Instant now) {
        AtomicReference<RetrainingTrigger> slot = slots.get(predictorId);
        if (slot == null) {
            return Optional.empty();
        }
        RetrainingTrigger existing = slot.get();
        if (existing == null || !existing.getId().equals(triggerId) || !slot.compareAndSet(existing, null)) {
            return Optional.empty();
        }
        return Optional.of(existing.consumed(now));
    }

    public Optional<RetrainingTrigger> pending(String predictorId) {
        AtomicReference<RetrainingTrigger> slot = slots.get(predictorId);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.get());
    }

    public Map<String, RetrainingTrigger> allPending() {
        Map<String, RetrainingTrigger> pending = new TreeMap<>();
        slots.forEach((id, slot) -> {
            RetrainingTrigger trigger = slot.get();
            if (trigger != null) {
                pending.put(id, trigger);
            }
        });
        return pending;
    }

    private AtomicReference<RetrainingTrigger> slot(String predictorId) {
        return slots.computeIfAbsent(predictorId, id -> new AtomicReference<>());
    }
}
