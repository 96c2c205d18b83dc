package io.contimg.pipeline.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * The durable record of a group having been emitted (or abandoned). The unique {@code groupId} is what
 * guarantees a group is handed to the pipeline at most once.
 */
@Entity
@Table(name = "processing_group")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String groupId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private FileKind kind;

    @Column(nullable = false)
    private String groupKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private GroupStatus status;

    private LocalDateTime windowStart;

    private LocalDateTime windowEnd;

    private int memberCount;

    @Column(length = 64)
    private String memberDigest;

    @Column(columnDefinition = "TEXT")
    private String remark;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
