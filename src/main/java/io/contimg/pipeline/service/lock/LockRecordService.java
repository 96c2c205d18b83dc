package io.contimg.pipeline.service.lock;

import io.contimg.pipeline.model.ResourceLock;
import io.contimg.pipeline.repository.ResourceLockRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Lock row operations, each committed on its own so a lock becomes visible to other workers the moment it
 * is taken and disappears the moment it is released, independent of any caller transaction.
 */
@Service
@RequiredArgsConstructor
public class LockRecordService {

    private final ResourceLockRepository lockRepository;

    /**
     * @throws DataIntegrityViolationException if the resource is already locked
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ResourceLock attemptToInsert(String resourceName, String holderId, LocalDateTime now)
            throws DataIntegrityViolationException {
        if (lockRepository.existsById(resourceName)) {
            throw new DataIntegrityViolationException("Resource '" + resourceName + "' is already locked");
        }
        return lockRepository.saveAndFlush(ResourceLock.builder()
                                                   .resourceName(resourceName)
                                                   .holderId(holderId)
                                                   .acquiredAt(now)
                                                   .heartbeatAt(now)
                                                   .build());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean delete(String resourceName, String holderId) {
        return lockRepository.release(resourceName, holderId) > 0;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int heartbeat(Collection<String> resourceNames, String holderId, LocalDateTime now) {
        return lockRepository.heartbeat(resourceNames, holderId, now);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean reclaim(ResourceLock observed) {
        return lockRepository.reclaim(observed.getResourceName(), observed.getHolderId(),
                                      observed.getHeartbeatAt()) > 0;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<ResourceLock> findAll() {
        return lockRepository.findAll();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<ResourceLock> find(String resourceName) {
        return lockRepository.findById(resourceName);
    }
}
