package io.contimg.pipeline.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A provenance edge between two artifacts, e.g. the raw units a converted unit was built from.
 */
@Entity
@Table(name = "artifact_relation", uniqueConstraints = @UniqueConstraint(name = "uk_artifact_relation",
        columnNames = {"parent_type", "parent_id", "child_type", "child_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArtifactRelation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "parent_type", nullable = false, length = 32)
    private DataType parentType;

    @Column(name = "parent_id", nullable = false, length = 512)
    private String parentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "child_type", nullable = false, length = 32)
    private DataType childType;

    @Column(name = "child_id", nullable = false, length = 512)
    private String childId;

    @Column(nullable = false, length = 32)
    private String relation;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
