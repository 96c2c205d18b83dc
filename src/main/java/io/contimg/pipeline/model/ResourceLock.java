package io.contimg.pipeline.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * An advisory, exclusive lock on a named resource. The primary key on {@code resourceName} makes
 * acquisition a single insert that either succeeds or collides.
 */
@Entity
@Table(name = "resource_lock")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceLock implements Persistable<String> {

    @Id
    @Column(length = 600)
    private String resourceName;

    /**
     * {@code host:pid:instance} of the holding process, used for liveness checks before reclaiming.
     */
    @Column(nullable = false)
    private String holderId;

    @Column(nullable = false)
    private LocalDateTime acquiredAt;

    @Column(nullable = false)
    private LocalDateTime heartbeatAt;

    /**
     * Forces {@code save} to INSERT, so a collision on the primary key surfaces as an integrity violation
     * instead of a merge that would silently take over someone else's lock.
     */
    @Transient
    @Builder.Default
    private boolean fresh = true;

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }

    @Override
    public String getId() {
        return resourceName;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }
}
