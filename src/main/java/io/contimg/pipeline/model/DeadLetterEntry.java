package io.contimg.pipeline.model;

import io.contimg.pipeline.model.converter.MetadataJsonConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A permanently failed operation awaiting operator action. Entries are never retried automatically.
 */
@Entity
@Table(name = "dead_letter_entry", indexes = {
        @Index(name = "idx_dlq_component", columnList = "component"),
        @Index(name = "idx_dlq_created", columnList = "created_at")})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String component;

    @Column(nullable = false, length = 128)
    private String operation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private DeadLetterReason reason;

    private String errorType;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    /**
     * Everything needed to replay the operation: stage, inputs and the output artifact key.
     */
    @Convert(converter = MetadataJsonConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();

    private int attemptCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DeadLetterStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime resolvedAt;

    private String resolvedBy;

    @Column(columnDefinition = "TEXT")
    private String resolutionNotes;
}
