package io.contimg.pipeline.service.resilience;

import io.contimg.pipeline.dto.deadletter.DeadLetterQuery;
import io.contimg.pipeline.dto.deadletter.DeadLetterStats;
import io.contimg.pipeline.exception.DeadLetterReplayException;
import io.contimg.pipeline.model.DeadLetterEntry;
import io.contimg.pipeline.model.DeadLetterReason;
import io.contimg.pipeline.model.DeadLetterStatus;
import io.contimg.pipeline.repository.DeadLetterEntryRepository;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable, append-only record of operations that failed permanently. Nothing here is retried automatically;
 * an entry leaves {@code PENDING} only by operator action (resolve or replay).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeadLetterQueueService {

    private final DeadLetterEntryRepository deadLetterRepository;
    private final Clock clock;

    /**
     * Appends an entry. Runs in its own transaction so the record survives a rollback of the failing work.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public DeadLetterEntry add(String component, String operation, DeadLetterReason reason, Throwable error,
                               Map<String, Object> context, int attemptCount) {
        DeadLetterEntry entry = DeadLetterEntry.builder()
                .component(component)
                .operation(operation)
                .reason(reason)
                .errorType(error == null ? null : error.getClass().getSimpleName())
                .errorMessage(error == null ? null : error.getMessage())
                .context(context == null ? new LinkedHashMap<>() : new LinkedHashMap<>(context))
                .attemptCount(attemptCount)
                .status(DeadLetterStatus.PENDING)
                .createdAt(LocalDateTime.now(clock))
                .build();
        DeadLetterEntry saved = deadLetterRepository.save(entry);
        log.error("[{}] Dead-lettered {}.{} ({}, {} attempt(s)): {}", saved.getId(), component, operation, reason,
                  attemptCount, saved.getErrorMessage());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<DeadLetterEntry> list(DeadLetterQuery filter) {
        Specification<DeadLetterEntry> specification = (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (StringUtils.hasText(filter.getComponent())) {
                predicates.add(cb.equal(root.get("component"), filter.getComponent()));
            }
            if (filter.getReason() != null) {
                predicates.add(cb.equal(root.get("reason"), filter.getReason()));
            }
            if (filter.getStatus() != null) {
                predicates.add(cb.equal(root.get("status"), filter.getStatus()));
            }
            if (filter.getSince() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), filter.getSince()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
        PageRequest page = PageRequest.of(0, filter.getLimit(), Sort.by(Sort.Direction.DESC, "createdAt"));
        return deadLetterRepository.findAll(specification, page).getContent();
    }

    @Transactional(readOnly = true)
    public Optional<DeadLetterEntry> get(Long id) {
        return deadLetterRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public DeadLetterStats stats() {
        return new DeadLetterStats(deadLetterRepository.countByStatus(DeadLetterStatus.PENDING),
                                   deadLetterRepository.countByStatus(DeadLetterStatus.REPLAYED),
                                   deadLetterRepository.countByStatus(DeadLetterStatus.RESOLVED),
                                   toCounts(deadLetterRepository.countByReason(DeadLetterStatus.PENDING)),
                                   toCounts(deadLetterRepository.countByComponent(DeadLetterStatus.PENDING)));
    }

    private static Map<String, Long> toCounts(List<Object[]> rows) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object[] row : rows) {
            counts.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
        }
        return counts;
    }

    /**
     * Closes a pending entry without replaying it.
     *
     * @throws DeadLetterReplayException if the entry does not exist or is no longer pending
     */
    @Transactional
    public void resolve(Long id, String resolvedBy, String notes) {
        close(id, DeadLetterStatus.RESOLVED, resolvedBy, notes);
        log.info("[{}] Dead letter resolved by '{}'.", id, resolvedBy);
    }

    @Transactional
    public void markReplayed(Long id, String replayedBy) {
        close(id, DeadLetterStatus.REPLAYED, replayedBy, "Replayed");
        log.info("[{}] Dead letter marked REPLAYED by '{}'.", id, replayedBy);
    }

    private void close(Long id, DeadLetterStatus newStatus, String by, String notes) {
        int updated = deadLetterRepository.closeIfPending(id, newStatus, by, notes, LocalDateTime.now(clock));
        if (updated == 0) {
            if (!deadLetterRepository.existsById(id)) {
                throw new DeadLetterReplayException("Dead letter " + id + " does not exist");
            }
            throw new DeadLetterReplayException("Dead letter " + id + " is no longer pending");
        }
    }

    @Transactional(readOnly = true)
    public long countPending() {
        return deadLetterRepository.countByStatus(DeadLetterStatus.PENDING);
    }
}
