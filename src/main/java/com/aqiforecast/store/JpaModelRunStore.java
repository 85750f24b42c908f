package com.aqiforecast.store;

import com.aqiforecast.domain.ValidationMetrics;
import com.aqiforecast.entity.ModelRunEntity;
import com.aqiforecast.entity.ModelVersionEntity;
import com.aqiforecast.repository.ModelRunRepository;
import com.aqiforecast.repository.ModelVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaModelRunStore implements ModelRunStore {

    private final ModelRunRepository runRepository;
    private final ModelVersionRepository versionRepository;

    @Override
    @Transactional
    public String saveRun(Map<String, Object> params, Map<String, Double> metrics, Map<String, String> artifacts) {
        Map<String, String> flatParams = new HashMap<>();
        if (params != null) {
            params.forEach((k, v) -> {
                if (v != null) {
                    flatParams.put(k, String.valueOf(v));
                }
            });
        }
        String predictorId = flatParams.get(PARAM_PREDICTOR_ID);
        String version = flatParams.get(PARAM_VERSION);

        ModelRunEntity run = runRepository.save(ModelRunEntity.builder()
            .predictorId(predictorId)
            .version(version)
            .params(flatParams)
            .metrics(metrics != null ? new HashMap<>(metrics) : new HashMap<>())
            .artifacts(artifacts != null ? new HashMap<>(artifacts) : new HashMap<>())
            .build());

        if (predictorId != null && version != null) {
            ModelVersionEntity entity = versionRepository.findByModelNameAndVersion(predictorId, version)
                .orElseGet(() -> ModelVersionEntity.builder()
                    .modelName(predictorId)
                    .version(version)
                    .stage(STAGE_NONE)
                    .build());
            entity.setRunId(run.getId());
            if (metrics != null) {
                entity.setRmse(metrics.get("rmse"));
                entity.setMae(metrics.get("mae"));
                entity.setAccuracyWithinThreshold(metrics.get("accuracy_within_threshold"));
                Double samples = metrics.get("sample_count");
                entity.setSampleCount(samples != null ? samples.longValue() : null);
            }
            versionRepository.save(entity);
        }
        log.debug("Model run saved | run={} | predictor={} | version={}", run.getId(), predictorId, version);
        return run.getId().toString();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredModelVersion> loadModel(String name, String version) {
        return versionRepository.findByModelNameAndVersion(name, version).map(this::toStored);
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredModelVersion> listVersions(String name) {
        return versionRepository.findByModelNameOrderByCreatedAtAsc(name).stream()
            .map(this::toStored)
            .toList();
    }

    @Override
    @Transactional
    public void promote(String name, String version, String stage) {
        ModelVersionEntity entity = versionRepository.findByModelNameAndVersion(name, version)
            .orElseGet(() -> ModelVersionEntity.builder()
                .modelName(name)
                .version(version)
                .build());
        int archived = versionRepository.archiveStage(name, stage, version, STAGE_ARCHIVED);
        entity.setStage(stage);
        versionRepository.save(entity);
        log.info("Model stage updated | model={} | version={} | stage={} | archived={}", name, version, stage, archived);
    }

    private StoredModelVersion toStored(ModelVersionEntity entity) {
        ValidationMetrics metrics = entity.getRmse() == null ? null : new ValidationMetrics(
            entity.getRmse(),
            entity.getMae() != null ? entity.getMae() : Double.NaN,
            entity.getAccuracyWithinThreshold() != null ? entity.getAccuracyWithinThreshold() : Double.NaN,
            entity.getSampleCount() != null ? entity.getSampleCount() : 0L);
        return new StoredModelVersion(
            entity.getModelName(),
            entity.getVersion(),
            entity.getStage(),
            entity.getRunId() != null ? entity.getRunId().toString() : null,
            metrics,
            entity.getCreatedAt(),
            entity.getUpdatedAt());
    }
}
