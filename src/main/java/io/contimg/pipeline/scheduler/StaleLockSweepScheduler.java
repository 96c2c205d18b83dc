package io.contimg.pipeline.scheduler;

import io.contimg.pipeline.model.ResourceLock;
import io.contimg.pipeline.service.lock.LockManager;
import io.contimg.pipeline.service.lock.LockRecordService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps this process's locks alive and removes locks whose holders are gone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleLockSweepScheduler {

    private final LockManager lockManager;
    private final LockRecordService lockRecordService;

    @Scheduled(fixedDelayString = "${app.scheduler.lock-heartbeat-delay-ms:30000}")
    public void heartbeat() {
        int refreshed = lockManager.heartbeatHeldLocks();
        if (refreshed > 0) {
            log.debug("Heartbeat refreshed {} held lock(s).", refreshed);
        }
    }

    @Scheduled(fixedDelayString = "${app.scheduler.lock-sweep-delay-ms:60000}")
    public void sweepStaleLocks() {
        int reclaimed = sweep();
        if (reclaimed > 0) {
            log.info("Stale lock sweep reclaimed {} lock(s).", reclaimed);
        }
    }

    /**
     * Reclaims every lock the {@link LockManager} judges abandoned. A lock that changed between inspection and
     * deletion is left alone.
     *
     * @return the number of locks reclaimed
     */
    public int sweep() {
        int reclaimed = 0;
        for (ResourceLock lock : lockRecordService.findAll()) {
            if (lockManager.isReclaimable(lock) && lockRecordService.reclaim(lock)) {
                log.warn("Reclaimed stale lock '{}' held by '{}' since {} (last heartbeat {}).",
                         lock.getResourceName(), lock.getHolderId(), lock.getAcquiredAt(), lock.getHeartbeatAt());
                reclaimed++;
            }
        }
        return reclaimed;
    }
}
