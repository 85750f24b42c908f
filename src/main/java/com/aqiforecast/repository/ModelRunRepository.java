package com.aqiforecast.repository;

import com.aqiforecast.entity.ModelRunEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ModelRunRepository extends JpaRepository<ModelRunEntity, UUID> {

    List<ModelRunEntity> findByPredictorIdOrderByCreatedAtDesc(String predictorId);
}
