package com.aqiforecast.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
    name = "model_runs",
    indexes = {
        @Index(name = "idx_run_predictor", columnList = "predictor_id"),
        @Index(name = "idx_run_created",   columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelRunEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "predictor_id", length = 100)
    private String predictorId;

    @Column(length = 100)
    private String version;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "model_run_params", joinColumns = @JoinColumn(name = "run_id"))
    @MapKeyColumn(name = "param_key", length = 100)
    @Column(name = "param_value", length = 1000)
    private Map<String, String> params = new HashMap<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "model_run_metrics", joinColumns = @JoinColumn(name = "run_id"))
    @MapKeyColumn(name = "metric_key", length = 100)
    @Column(name = "metric_value")
    private Map<String, Double> metrics = new HashMap<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "model_run_artifacts", joinColumns = @JoinColumn(name = "run_id"))
    @MapKeyColumn(name = "artifact_key", length = 100)
    @Column(name = "artifact_uri", length = 1000)
    private Map<String, String> artifacts = new HashMap<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
