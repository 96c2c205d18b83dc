package io.contimg.pipeline.model;

import io.contimg.pipeline.model.converter.MetadataJsonConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tracked data product and its lifecycle state. Rows are never deleted; failures and supersessions
 * are recorded in place so the table doubles as an audit trail.
 */
@Entity
@Table(name = "artifact",
        uniqueConstraints = @UniqueConstraint(name = "uk_artifact_type_id", columnNames = {"data_type", "data_id"}),
        indexes = {@Index(name = "idx_artifact_state", columnList = "lifecycle_state")})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Artifact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "data_type", nullable = false, length = 32)
    private DataType dataType;

    @Column(name = "data_id", nullable = false, length = 512)
    private String dataId;

    @Column(length = 1024)
    private String stagePath;

    @Enumerated(EnumType.STRING)
    @Column(name = "lifecycle_state", nullable = false, length = 16)
    private LifecycleState lifecycleState;

    @Column(nullable = false)
    @Builder.Default
    private int publishAttempts = 0;

    @Column(columnDefinition = "TEXT")
    private String publishError;

    @Convert(converter = MetadataJsonConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @Transient
    public ArtifactKey key() {
        return new ArtifactKey(dataType, dataId);
    }

    @Transient
    public boolean isPublished() {
        return lifecycleState == LifecycleState.PUBLISHED;
    }
}
