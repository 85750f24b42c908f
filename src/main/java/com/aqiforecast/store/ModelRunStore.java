package com.aqiforecast.store;

import com.aqiforecast.exception.PersistenceException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Experiment tracking and model registry backing the retraining lifecycle.
 * Implementations may throw {@link PersistenceException} when the backing store is unreachable.
 */
public interface ModelRunStore {

    String PARAM_PREDICTOR_ID = "predictor_id";
    String PARAM_VERSION = "version";

    String STAGE_NONE = "None";
    String STAGE_ARCHIVED = "Archived";

    /**
     * Records one retraining run. When the params name a predictor and a version, the version
     * is registered under the predictor's model name and linked to the run.
     *
     * @return the run id
     */
    String saveRun(Map<String, Object> params, Map<String, Double> metrics, Map<String, String> artifacts);

    Optional<StoredModelVersion> loadModel(String name, String version);

    /**
     * Versions of a model in registration order.
     */
    List<StoredModelVersion> listVersions(String name);

    /**
     * Moves a version to the given stage; any other version of the model in that stage is archived.
     */
    void promote(String name, String version, String stage);
}
