package io.contimg.pipeline.service.lock;

import lombok.Getter;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A held lock. Closing the handle releases the lock; closing it twice is harmless.
 */
public class LockHandle implements AutoCloseable {

    @Getter
    private final String resourceName;
    @Getter
    private final LocalDateTime acquiredAt;
    private final LockManager owner;
    private final AtomicBoolean released = new AtomicBoolean(false);

    LockHandle(String resourceName, LocalDateTime acquiredAt, LockManager owner) {
        this.resourceName = resourceName;
        this.acquiredAt = acquiredAt;
        this.owner = owner;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            owner.release(resourceName);
        }
    }
}
