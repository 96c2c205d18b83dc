package io.contimg.pipeline.service.lock;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.exception.LockTimeoutException;
import io.contimg.pipeline.exception.PipelineException;
import io.contimg.pipeline.model.ResourceLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Advisory, exclusive locks on named resources, stored in the same database as the artifact registry.
 * <p>
 * Acquisition inserts a row keyed by the resource name; a collision means someone else holds it and the caller
 * polls until the timeout. Locks held by this process are heartbeated so the stale-lock sweeper of another
 * process can tell a slow holder from a dead one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LockManager {

    private final LockRecordService lockRecordService;
    private final HolderIdentity holderIdentity;
    private final PipelineConfig pipelineConfig;
    private final Clock clock;

    private final Set<String> heldResources = ConcurrentHashMap.newKeySet();

    public LockHandle acquire(String resourceName) {
        PipelineConfig.Lock config = pipelineConfig.getLock();
        return acquire(resourceName, config.getAcquireTimeout(), config.getPollInterval());
    }

    /**
     * Blocks until the lock is taken or the timeout elapses.
     *
     * @throws LockTimeoutException if the resource stayed locked for the whole timeout
     */
    public LockHandle acquire(String resourceName, Duration timeout, Duration pollInterval) {
        long deadline = System.nanoTime() + timeout.toNanos();
        int collisions = 0;
        while (true) {
            LocalDateTime now = LocalDateTime.now(clock);
            try {
                lockRecordService.attemptToInsert(resourceName, holderIdentity.getHolderId(), now);
                heldResources.add(resourceName);
                if (collisions > 0) {
                    log.debug("Acquired lock '{}' after {} collision(s).", resourceName, collisions);
                }
                return new LockHandle(resourceName, now, this);
            } catch (DataIntegrityViolationException e) {
                collisions++;
            }
            if (System.nanoTime() >= deadline) {
                log.warn("Timed out after {} waiting for lock '{}'.", timeout, resourceName);
                throw new LockTimeoutException(resourceName, timeout);
            }
            sleep(pollInterval, resourceName);
        }
    }

    /**
     * Runs {@code action} while holding the lock and releases it afterwards, also when the action throws.
     */
    public <T> T withLock(String resourceName, Supplier<T> action) {
        try (LockHandle ignored = acquire(resourceName)) {
            return action.get();
        }
    }

    void release(String resourceName) {
        heldResources.remove(resourceName);
        if (!lockRecordService.delete(resourceName, holderIdentity.getHolderId())) {
            log.warn("Lock '{}' was no longer held by this process at release; it may have been reclaimed.",
                     resourceName);
        }
    }

    /**
     * Refreshes the heartbeat of every lock this process currently holds.
     *
     * @return the number of lock rows refreshed
     */
    public int heartbeatHeldLocks() {
        if (heldResources.isEmpty()) {
            return 0;
        }
        return lockRecordService.heartbeat(Set.copyOf(heldResources), holderIdentity.getHolderId(),
                                           LocalDateTime.now(clock));
    }

    /**
     * Decides whether an existing lock may be reclaimed. A lock held by a live process on this host is never
     * reclaimable however old its heartbeat; a lock whose local holder died is reclaimable at once; a remote
     * holder is judged by heartbeat age alone.
     */
    public boolean isReclaimable(ResourceLock lock) {
        String holder = lock.getHolderId();
        if (holderIdentity.isSelf(holder)) {
            return false;
        }
        if (holderIdentity.isLocal(holder)) {
            return !holderIdentity.isAlive(holder);
        }
        Duration age = Duration.between(lock.getHeartbeatAt(), LocalDateTime.now(clock));
        return age.compareTo(pipelineConfig.getLock().getStaleAfter()) > 0;
    }

    public boolean isHeld(String resourceName) {
        return heldResources.contains(resourceName);
    }

    private static void sleep(Duration pollInterval, String resourceName) {
        try {
            Thread.sleep(Math.max(1, pollInterval.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while waiting for lock '" + resourceName + "'", e);
        }
    }
}
