package com.aqiforecast.service;

import com.aqiforecast.domain.PerformanceRecord;
import com.aqiforecast.domain.WeightVector;
import com.aqiforecast.predictor.PredictorCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of the ensemble weight vector. Readers always get a complete vector; refreshes
 * publish a new one by reference swap.
 */
@Slf4j
@Service
public class WeightStore {

    private final WeightAdapter weightAdapter;
    private final PerformanceTracker performanceTracker;
    private final PredictorCatalog catalog;
    private final AtomicReference<WeightVector> current;

    public WeightStore(WeightAdapter weightAdapter, PerformanceTracker performanceTracker, PredictorCatalog catalog) {
        this.weightAdapter = weightAdapter;
        this.performanceTracker = performanceTracker;
        this.catalog = catalog;
        this.current = new AtomicReference<>(WeightVector.uniform(catalog.ids()));
    }

    public WeightVector current() {
        return current.get();
    }

    public synchronized WeightVector refresh() {
        Map<String, PerformanceRecord> snapshots = new LinkedHashMap<>();
        for (String id : catalog.ids()) {
            performanceTracker.latest(id).ifPresentOrElse(
                record -> snapshots.put(id, record),
                () -> log.debug("No performance snapshot for weight update | predictor={}", id));
        }
        WeightVector previous = current.get();
        WeightVector updated = weightAdapter.recompute(snapshots, previous);
        current.set(updated);
        log.info("Ensemble weights updated | weights={} | snapshots={}", updated.asMap(), snapshots.size());
        return updated;
    }
}
