package com.aqiforecast.service;

import com.aqiforecast.domain.RetrainingTrigger;
import com.aqiforecast.domain.Severity;
import com.aqiforecast.domain.TriggerType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class PendingTriggerSlotsTest {

    private static final Instant T0 = Instant.parse("2025-06-15T12:00:00Z");

    private final PendingTriggerSlots slots = new PendingTriggerSlots();

    @Test
    void offer_equalOrLowerSeverity_isDeduplicated() {
        RetrainingTrigger first = trigger("xgboost", Severity.HIGH);

        assertThat(slots.offer(first).status()).isEqualTo(PendingTriggerSlots.OfferStatus.ACCEPTED);
        PendingTriggerSlots.Offer same = slots.offer(trigger("xgboost", Severity.HIGH));
        PendingTriggerSlots.Offer lower = slots.offer(trigger("xgboost", Severity.LOW));

        assertThat(same.status()).isEqualTo(PendingTriggerSlots.OfferStatus.DEDUPLICATED);
        assertThat(lower.created()).isFalse();
        assertThat(slots.pending("xgboost")).contains(first);
    }

    @Test
    void offer_higherSeverity_replacesPending() {
        RetrainingTrigger low = trigger("lstm", Severity.LOW);
        RetrainingTrigger critical = trigger("lstm", Severity.CRITICAL);
        slots.offer(low);

        PendingTriggerSlots.Offer offer = slots.offer(critical);

        assertThat(offer.status()).isEqualTo(PendingTriggerSlots.OfferStatus.REPLACED);
        assertThat(offer.replaced()).isEqualTo(low);
        assertThat(slots.pending("lstm")).contains(critical);
    }

    @Test
    void claim_consumesOnce() {
        RetrainingTrigger trigger = trigger("gnn", Severity.MEDIUM);
        slots.offer(trigger);

        Optional<RetrainingTrigger> first = slots.claim("gnn", T0);
        Optional<RetrainingTrigger> second = slots.claim("gnn", T0);

        assertThat(first).isPresent();
        assertThat(first.get().getId()).isEqualTo(trigger.getId());
        assertThat(first.get().getConsumedAt()).isEqualTo(T0);
        assertThat(second).isEmpty();
        assertThat(slots.allPending()).isEmpty();
    }

    @Test
    void claimById_ignoresStaleTrigger() {
        RetrainingTrigger low = trigger("gnn", Severity.LOW);
        slots.offer(low);
        slots.offer(trigger("gnn", Severity.HIGH));

        assertThat(slots.claim("gnn", low.getId(), T0)).isEmpty();
        assertThat(slots.pending("gnn")).isPresent();
    }

    @Test
    void concurrentOffers_leaveSingleHighestTrigger() throws Exception {
        List<Callable<PendingTriggerSlots.Offer>> offers = new ArrayList<>();
        for (int i = 0; i < 400; i++) {
            Severity severity = Severity.values()[i % Severity.values().length];
            offers.add(() -> slots.offer(trigger("xgboost", severity)));
        }

        runConcurrently(offers);

        assertThat(slots.allPending()).hasSize(1);
        assertThat(slots.pending("xgboost").orElseThrow().getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void concurrentClaims_handOutTriggerExactlyOnce() throws Exception {
        slots.offer(trigger("lstm", Severity.HIGH));
        List<Callable<Optional<RetrainingTrigger>>> claims = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            claims.add(() -> slots.claim("lstm", T0));
        }

        List<Optional<RetrainingTrigger>> results = runConcurrently(claims);

        assertThat(results.stream().filter(Optional::isPresent).count()).isEqualTo(1);
    }

    private static <T> List<T> runConcurrently(List<Callable<T>> tasks) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (Callable<T> task : tasks) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private static RetrainingTrigger trigger(String predictorId, Severity severity) {
        return RetrainingTrigger.create(predictorId, TriggerType.PERFORMANCE, severity, "test", Map.of(), T0);
    }
}
