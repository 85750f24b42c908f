package com.aqiforecast.config;

import com.aqiforecast.exception.PersistenceException;
import com.aqiforecast.predictor.PredictorCatalog;
import com.aqiforecast.service.ModelVersionRegistry;
import com.aqiforecast.service.RetrainingScheduler;
import com.aqiforecast.store.ModelRunStore;
import com.aqiforecast.store.StoredModelVersion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Registers each predictor's stored Production version at startup so the lifecycle resumes
 * where it stopped. A predictor whose store lookup fails starts with no active version.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegistrySeeder implements ApplicationRunner {

    private final PredictorCatalog catalog;
    private final ModelRunStore modelRunStore;
    private final ModelVersionRegistry registry;
    private final RetrainingScheduler scheduler;
    private final ForecastProperties properties;
    private final Clock clock;

    @Override
    public void run(ApplicationArguments args) {
        String stage = properties.getRetraining().getProductionStage();
        for (String predictorId : catalog.ids()) {
            try {
                List<StoredModelVersion> versions = modelRunStore.listVersions(predictorId);
                Optional<StoredModelVersion> production = versions.stream()
                    .filter(v -> v.inStage(stage))
                    .reduce((first, second) -> second);
                production.ifPresentOrElse(v -> {
                    registry.seed(predictorId, v.version(), v.metrics(), v.updatedAt());
                    scheduler.recordRun(predictorId, v.updatedAt() != null ? v.updatedAt() : clock.instant());
                }, () -> log.info("No stored Production version | predictor={}", predictorId));
            } catch (PersistenceException ex) {
                log.warn("Registry seeding skipped | predictor={} | reason={}", predictorId, ex.getMessage());
            }
        }
    }
}
