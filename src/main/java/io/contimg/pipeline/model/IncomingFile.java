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
 * One entry in the append-only file arrival index read by the group detector.
 */
@Entity
@Table(name = "incoming_file", indexes = {
        @Index(name = "idx_incoming_lookup", columnList = "kind, group_key, observed_at"),
        @Index(name = "idx_incoming_status", columnList = "kind, upstream_status")})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncomingFile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 1024)
    private String path;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private FileKind kind;

    @Column(name = "group_key", nullable = false)
    private String groupKey;

    private Integer memberIndex;

    /**
     * The observation timestamp. Entries whose name could not be resolved to a time keep this null and are
     * ignored by detection.
     */
    @Column(name = "observed_at")
    private LocalDateTime observedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "upstream_status", nullable = false, length = 16)
    private UpstreamStatus upstreamStatus;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime receivedAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
