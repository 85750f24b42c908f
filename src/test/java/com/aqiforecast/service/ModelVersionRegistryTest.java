package com.aqiforecast.service;

import com.aqiforecast.domain.ModelVersionRecord;
import com.aqiforecast.domain.ModelVersionState;
import com.aqiforecast.domain.ValidationMetric;
import com.aqiforecast.domain.ValidationMetrics;
import com.aqiforecast.exception.ConcurrencyConflictException;
import com.aqiforecast.exception.IllegalStateTransitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.NoSuchElementException;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class ModelVersionRegistryTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    private ModelVersionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ModelVersionRegistry(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void promote_archivesPreviousActiveVersion() {
        ModelVersionRecord first = runToValidating("xgboost", "v1");
        registry.promote("xgboost", first.getRecordId(), metrics(12.0, 0.8));
        ModelVersionRecord second = runToValidating("xgboost", "v2");

        ModelVersionRecord promoted = registry.promote("xgboost", second.getRecordId(), metrics(10.0, 0.85));

        assertThat(promoted.getState()).isEqualTo(ModelVersionState.PROMOTED);
        assertThat(promoted.getPromotedAt()).isEqualTo(NOW);
        assertThat(registry.getActive("xgboost")).contains(promoted);
        assertThat(registry.find("xgboost", first.getRecordId()).orElseThrow().getState())
            .isEqualTo(ModelVersionState.ARCHIVED);
        assertThat(registry.history("xgboost"))
            .filteredOn(r -> r.getState() == ModelVersionState.PROMOTED).hasSize(1);
    }

    @Test
    void open_whileRunInFlight_conflicts() {
        registry.open("lstm", UUID.randomUUID());

        assertThatThrownBy(() -> registry.open("lstm", UUID.randomUUID()))
            .isInstanceOf(ConcurrencyConflictException.class);
        assertThat(registry.inFlight("lstm")).isPresent();
    }

    @Test
    void transition_rejectsMovesOutsideLifecycle() {
        ModelVersionRecord record = registry.open("gnn", UUID.randomUUID());

        assertThatThrownBy(() -> registry.transition("gnn", record.getRecordId(), ModelVersionState.VALIDATING))
            .isInstanceOf(IllegalStateTransitionException.class);
        assertThatThrownBy(() -> registry.transition("gnn", record.getRecordId(), ModelVersionState.PROMOTED))
            .isInstanceOf(IllegalStateTransitionException.class);

        registry.transition("gnn", record.getRecordId(), ModelVersionState.FAILED);

        assertThatThrownBy(() -> registry.transition("gnn", record.getRecordId(), ModelVersionState.RUNNING))
            .isInstanceOf(IllegalStateTransitionException.class);
        assertThat(registry.tryTransition("gnn", record.getRecordId(), ModelVersionState.ROLLED_BACK, r -> r)).isEmpty();
        assertThat(registry.inFlight("gnn")).isEmpty();
    }

    @Test
    void transition_unknownRecord_throws() {
        registry.open("gnn", UUID.randomUUID());

        assertThatThrownBy(() -> registry.transition("gnn", UUID.randomUUID(), ModelVersionState.RUNNING))
            .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void seed_onlyWhenNoActiveVersion() {
        assertThat(registry.seed("xgboost", "v7", metrics(11.0, 0.8), NOW.minusSeconds(60))).isPresent();
        assertThat(registry.seed("xgboost", "v8", metrics(9.0, 0.9), NOW)).isEmpty();
        assertThat(registry.getActive("xgboost").orElseThrow().getVersion()).isEqualTo("v7");
    }

    @Test
    void compare_picksBestAmongValidatedVersions() {
        ModelVersionRecord v1 = runToValidating("xgboost", "v1");
        registry.promote("xgboost", v1.getRecordId(), metrics(12.0, 0.80));
        ModelVersionRecord v2 = runToValidating("xgboost", "v2");
        registry.transition("xgboost", v2.getRecordId(), ModelVersionState.ROLLED_BACK,
            r -> r.toBuilder().metrics(metrics(13.0, 0.92)).build());
        ModelVersionRecord v3 = runToValidating("xgboost", "v3");
        registry.transition("xgboost", v3.getRecordId(), ModelVersionState.FAILED,
            r -> r.toBuilder().metrics(metrics(5.0, 0.99)).build());

        assertThat(registry.compare("xgboost", ValidationMetric.RMSE).orElseThrow().getVersion()).isEqualTo("v1");
        assertThat(registry.compare("xgboost", ValidationMetric.ACCURACY_WITHIN_THRESHOLD).orElseThrow().getVersion())
            .isEqualTo("v2");
        assertThat(registry.compare("lstm", ValidationMetric.RMSE)).isEmpty();
    }

    private ModelVersionRecord runToValidating(String predictorId, String version) {
        ModelVersionRecord record = registry.open(predictorId, UUID.randomUUID());
        registry.transition(predictorId, record.getRecordId(), ModelVersionState.RUNNING);
        return registry.transition(predictorId, record.getRecordId(), ModelVersionState.VALIDATING,
            r -> r.toBuilder().version(version).build());
    }

    private static ValidationMetrics metrics(double rmse, double accuracy) {
        return new ValidationMetrics(rmse, rmse * 0.8, accuracy, 200);
    }
}
