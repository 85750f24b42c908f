package com.aqiforecast.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "model_versions",
    uniqueConstraints = @UniqueConstraint(name = "uk_version_name", columnNames = {"model_name", "version"}),
    indexes = @Index(name = "idx_version_stage", columnList = "model_name, stage")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelVersionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_name", nullable = false, length = 100)
    private String modelName;

    @Column(nullable = false, length = 100)
    private String version;

    @Column(nullable = false, length = 30)
    private String stage;

    @Column(name = "run_id")
    private UUID runId;

    private Double rmse;
    private Double mae;

    @Column(name = "accuracy_within_threshold")
    private Double accuracyWithinThreshold;

    @Column(name = "sample_count")
    private Long sampleCount;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
