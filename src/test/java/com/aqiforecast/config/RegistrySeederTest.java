package com.aqiforecast.config;

import com.aqiforecast.domain.ValidationMetrics;
import com.aqiforecast.exception.PersistenceException;
import com.aqiforecast.predictor.PredictorCatalog;
import com.aqiforecast.predictor.StubPredictor;
import com.aqiforecast.service.ModelVersionRegistry;
import com.aqiforecast.service.RetrainingScheduler;
import com.aqiforecast.store.ModelRunStore;
import com.aqiforecast.store.StoredModelVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RegistrySeederTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    @Mock private ModelRunStore modelRunStore;
    @Mock private RetrainingScheduler scheduler;

    private ModelVersionRegistry registry;
    private RegistrySeeder seeder;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        registry = new ModelVersionRegistry(clock);
        PredictorCatalog catalog = new PredictorCatalog(List.of(
            new StubPredictor("xgboost", 80.0), new StubPredictor("lstm", 90.0)));
        seeder = new RegistrySeeder(catalog, modelRunStore, registry, scheduler, new ForecastProperties(), clock);
    }

    @Test
    void run_seedsLatestProductionVersion() {
        Instant promotedAt = NOW.minusSeconds(86_400);
        when(modelRunStore.listVersions("xgboost")).thenReturn(List.of(
            stored("xgboost", "v1", "Archived", null),
            stored("xgboost", "v2", "Production", promotedAt),
            stored("xgboost", "v3", "None", null)));
        when(modelRunStore.listVersions("lstm")).thenReturn(List.of());

        seeder.run(null);

        assertThat(registry.getActive("xgboost").orElseThrow().getVersion()).isEqualTo("v2");
        assertThat(registry.getActive("lstm")).isEmpty();
        verify(scheduler).recordRun("xgboost", promotedAt);
        verify(scheduler, never()).recordRun(eq("lstm"), any());
    }

    @Test
    void run_storeUnavailable_skipsPredictor() {
        when(modelRunStore.listVersions("xgboost"))
            .thenThrow(new PersistenceException("listVersions", 3, new RuntimeException("db down")));
        when(modelRunStore.listVersions("lstm")).thenReturn(List.of(stored("lstm", "v9", "Production", null)));

        seeder.run(null);

        assertThat(registry.getActive("xgboost")).isEmpty();
        assertThat(registry.getActive("lstm").orElseThrow().getVersion()).isEqualTo("v9");
        verify(scheduler).recordRun("lstm", NOW);
    }

    private static StoredModelVersion stored(String name, String version, String stage, Instant updatedAt) {
        return new StoredModelVersion(name, version, stage, null, new ValidationMetrics(10.0, 8.0, 0.85, 100),
            updatedAt, updatedAt);
    }
}
