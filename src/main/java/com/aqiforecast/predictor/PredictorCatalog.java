package com.aqiforecast.predictor;

import com.aqiforecast.exception.UnknownModelException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The predictors taking part in the ensemble, keyed by id in registration order.
 */
public class PredictorCatalog {

    private final Map<String, Predictor> predictors;

    public PredictorCatalog(List<Predictor> predictors) {
        Map<String, Predictor> map = new LinkedHashMap<>();
        for (Predictor p : predictors) {
            if (map.putIfAbsent(p.id(), p) != null) {
                throw new IllegalArgumentException("Duplicate predictor id '" + p.id() + "'");
            }
        }
        this.predictors = Collections.unmodifiableMap(map);
    }

    public Predictor require(String predictorId) {
        return find(predictorId).orElseThrow(() -> new UnknownModelException(predictorId));
    }

    public Optional<Predictor> find(String predictorId) {
        return Optional.ofNullable(predictorId).map(predictors::get);
    }

    public boolean contains(String predictorId) {
        return predictorId != null && predictors.containsKey(predictorId);
    }

    public Set<String> ids() {
        return predictors.keySet();
    }

    public Collection<Predictor> all() {
        return predictors.values();
    }
}
