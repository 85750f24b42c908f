package com.aqiforecast.job;

import com.aqiforecast.predictor.PredictorCatalog;
import com.aqiforecast.service.RetrainingOrchestrator;
import com.aqiforecast.service.RetrainingScheduler;
import com.aqiforecast.service.RetrainingTriggerEngine;
import com.aqiforecast.service.WeightStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic ticks of the model lifecycle. Each tick only creates or dispatches work and returns;
 * none waits for a retraining run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "forecast.jobs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ModelLifecycleJobs {

    private final PredictorCatalog catalog;
    private final WeightStore weightStore;
    private final RetrainingTriggerEngine triggerEngine;
    private final RetrainingScheduler scheduler;
    private final RetrainingOrchestrator orchestrator;

    @Scheduled(fixedDelayString = "${forecast.weights.tick-interval:PT1H}",
               initialDelayString = "${forecast.weights.tick-interval:PT1H}")
    public void refreshWeights() {
        try {
            weightStore.refresh();
        } catch (RuntimeException ex) {
            log.error("Weight refresh tick failed", ex);
        }
    }

    @Scheduled(fixedDelayString = "${forecast.triggers.evaluation-interval:PT30M}",
               initialDelayString = "${forecast.triggers.evaluation-interval:PT30M}")
    public void evaluateTriggers() {
        try {
            List<String> idle = catalog.ids().stream()
                .filter(id -> !orchestrator.isRetraining(id))
                .toList();
            int created = triggerEngine.evaluateAll(idle).size();
            int started = orchestrator.dispatchPending().size();
            log.debug("Trigger evaluation tick | created={} | started={}", created, started);
        } catch (RuntimeException ex) {
            log.error("Trigger evaluation tick failed", ex);
        }
    }

    @Scheduled(fixedDelayString = "${forecast.schedule.check-interval:PT30M}",
               initialDelayString = "PT1M")
    public void checkSchedule() {
        try {
            scheduler.tick();
            orchestrator.dispatchPending();
        } catch (RuntimeException ex) {
            log.error("Schedule tick failed", ex);
        }
    }
}
