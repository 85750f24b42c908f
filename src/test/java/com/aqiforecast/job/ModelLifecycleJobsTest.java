package com.aqiforecast.job;

import com.aqiforecast.predictor.PredictorCatalog;
import com.aqiforecast.predictor.StubPredictor;
import com.aqiforecast.service.RetrainingOrchestrator;
import com.aqiforecast.service.RetrainingScheduler;
import com.aqiforecast.service.RetrainingTriggerEngine;
import com.aqiforecast.service.WeightStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelLifecycleJobsTest {

    @Mock private WeightStore weightStore;
    @Mock private RetrainingTriggerEngine triggerEngine;
    @Mock private RetrainingScheduler scheduler;
    @Mock private RetrainingOrchestrator orchestrator;

    private PredictorCatalog catalog;
    private ModelLifecycleJobs jobs;

    @BeforeEach
    void setUp() {
        catalog = new PredictorCatalog(List.of(new StubPredictor("xgboost", 80.0), new StubPredictor("lstm", 90.0)));
        jobs = new ModelLifecycleJobs(catalog, weightStore, triggerEngine, scheduler, orchestrator);
    }

    @Test
    void evaluateTriggers_evaluatesThenDispatches() {
        when(triggerEngine.evaluateAll(anyCollection())).thenReturn(List.of());
        when(orchestrator.dispatchPending()).thenReturn(List.of());

        jobs.evaluateTriggers();

        var order = inOrder(triggerEngine, orchestrator);
        order.verify(triggerEngine).evaluateAll(List.of("xgboost", "lstm"));
        order.verify(orchestrator).dispatchPending();
    }

    @Test
    void evaluateTriggers_skipsPredictorsBeingRetrained() {
        when(orchestrator.isRetraining(anyString())).thenAnswer(inv -> "xgboost".equals(inv.getArgument(0)));
        when(triggerEngine.evaluateAll(anyCollection())).thenReturn(List.of());

        jobs.evaluateTriggers();

        verify(triggerEngine).evaluateAll(List.of("lstm"));
    }

    @Test
    void checkSchedule_ticksThenDispatches() {
        jobs.checkSchedule();

        var order = inOrder(scheduler, orchestrator);
        order.verify(scheduler).tick();
        order.verify(orchestrator).dispatchPending();
    }

    @Test
    void refreshWeights_failureDoesNotEscape() {
        when(weightStore.refresh()).thenThrow(new IllegalStateException("boom"));

        assertThatCode(jobs::refreshWeights).doesNotThrowAnyException();
    }
}
