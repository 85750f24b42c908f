package com.aqiforecast.repository;

import com.aqiforecast.entity.ModelVersionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ModelVersionRepository extends JpaRepository<ModelVersionEntity, UUID> {

    Optional<ModelVersionEntity> findByModelNameAndVersion(String modelName, String version);

    List<ModelVersionEntity> findByModelNameOrderByCreatedAtAsc(String modelName);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ModelVersionEntity v
        SET v.stage = :archived
        WHERE v.modelName = :name
          AND v.stage = :stage
          AND v.version <> :version
    """)
    int archiveStage(@Param("name") String name,
                     @Param("stage") String stage,
                     @Param("version") String version,
                     @Param("archived") String archived);
}
