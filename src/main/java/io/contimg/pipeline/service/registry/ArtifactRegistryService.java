package io.contimg.pipeline.service.registry;

import io.contimg.pipeline.dto.registry.ArtifactLineage;
import io.contimg.pipeline.dto.registry.ArtifactQuery;
import io.contimg.pipeline.exception.ArtifactNotFoundException;
import io.contimg.pipeline.model.Artifact;
import io.contimg.pipeline.model.ArtifactKey;
import io.contimg.pipeline.model.ArtifactRelation;
import io.contimg.pipeline.model.DataType;
import io.contimg.pipeline.model.LifecycleState;
import io.contimg.pipeline.repository.ArtifactRelationRepository;
import io.contimg.pipeline.repository.ArtifactRepository;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The durable artifact state machine: {@code STAGING -> PUBLISHING -> PUBLISHED}, with {@code FAILED} as the
 * parking state for artifacts that exhausted their publish attempts or failed validation.
 * <p>
 * Every transition is a single conditional UPDATE. A transition whose precondition does not hold changes
 * nothing and returns {@code false}, so concurrent callers racing for the same transition see exactly one
 * winner.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArtifactRegistryService {

    private static final List<LifecycleState> ACTIVE_STATES = List.of(LifecycleState.STAGING,
                                                                      LifecycleState.PUBLISHING);

    private final ArtifactRepository artifactRepository;
    private final ArtifactRelationRepository relationRepository;
    private final ArtifactAtomicService atomicService;
    private final Clock clock;

    /**
     * Registers an artifact. Registration is an idempotent upsert: a second call for the same key merges
     * {@code metadata} into the existing row and, while the artifact is still staging, refreshes its path.
     * A new row always starts in {@code STAGING}.
     */
    @Transactional
    public Artifact register(ArtifactKey key, String stagePath, Map<String, Object> metadata) {
        Optional<Artifact> existing = artifactRepository.findByDataTypeAndDataId(key.dataType(), key.dataId());
        if (existing.isPresent()) {
            return mergeInto(existing.get(), stagePath, metadata);
        }

        Artifact candidate = Artifact.builder()
                .dataType(key.dataType())
                .dataId(key.dataId())
                .stagePath(stagePath)
                .lifecycleState(LifecycleState.STAGING)
                .metadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata))
                .build();
        try {
            Artifact created = atomicService.attemptToCreate(candidate);
            log.info("[{}] Registered new artifact in STAGING at '{}'.", key, stagePath);
            return created;
        } catch (DataIntegrityViolationException e) {
            log.debug("[{}] Lost registration race; merging into the winning row.", key);
            Artifact winner = artifactRepository.findByDataTypeAndDataId(key.dataType(), key.dataId())
                    .orElseThrow(() -> new IllegalStateException(
                            "Artifact " + key + " collided on insert but could not be re-read", e));
            return mergeInto(winner, stagePath, metadata);
        }
    }

    private Artifact mergeInto(Artifact artifact, String stagePath, Map<String, Object> metadata) {
        ArtifactKey key = artifact.key();
        if (!CollectionUtils.isEmpty(metadata)) {
            writeMetadata(key, artifact.getMetadata(), metadata);
        }
        if (stagePath != null) {
            artifactRepository.updateStagePath(key.dataType(), key.dataId(), stagePath,
                                               List.of(LifecycleState.STAGING), now());
        }
        return get(key);
    }

    /**
     * Merges metadata into an existing artifact and optionally moves its path pointer, regardless of state.
     * Lifecycle state and attempt count are left to the transition statements.
     */
    @Transactional
    public Artifact updateContent(ArtifactKey key, String stagePath, Map<String, Object> metadata) {
        Artifact artifact = get(key);
        if (!CollectionUtils.isEmpty(metadata)) {
            writeMetadata(key, artifact.getMetadata(), metadata);
        }
        if (stagePath != null) {
            artifactRepository.updateStagePath(key.dataType(), key.dataId(), stagePath,
                                               EnumSet.allOf(LifecycleState.class), now());
        }
        return get(key);
    }

    private void writeMetadata(ArtifactKey key, Map<String, Object> current, Map<String, Object> additions) {
        Map<String, Object> merged = current == null ? new LinkedHashMap<>() : new LinkedHashMap<>(current);
        merged.putAll(additions);
        artifactRepository.updateMetadata(key.dataType(), key.dataId(), merged, now());
    }

    /**
     * Claims a staging artifact for publishing and counts the attempt.
     *
     * @return {@code true} if this caller won the {@code STAGING -> PUBLISHING} transition
     */
    @Transactional
    public boolean markPublishing(ArtifactKey key) {
        int updated = artifactRepository.claimForPublishing(key.dataType(), key.dataId(), now());
        log.debug("[{}] markPublishing -> {}", key, updated > 0);
        return updated > 0;
    }

    @Transactional
    public boolean markPublished(ArtifactKey key) {
        int updated = artifactRepository.transition(key.dataType(), key.dataId(), LifecycleState.PUBLISHING,
                                                    LifecycleState.PUBLISHED, now());
        if (updated > 0) {
            log.info("[{}] Artifact PUBLISHED.", key);
        }
        return updated > 0;
    }

    /**
     * Records a failed publish attempt. While the artifact has attempts left it goes back to {@code STAGING}
     * for another try; after {@code maxAttempts} it is parked in {@code FAILED}.
     *
     * @return the state the artifact moved to, or empty if it was not {@code PUBLISHING}
     */
    @Transactional
    public Optional<LifecycleState> markFailed(ArtifactKey key, String error, int maxAttempts) {
        LocalDateTime now = now();
        if (artifactRepository.failToStaging(key.dataType(), key.dataId(), error, maxAttempts, now) > 0) {
            log.warn("[{}] Publish attempt failed, back to STAGING: {}", key, error);
            return Optional.of(LifecycleState.STAGING);
        }
        if (artifactRepository.failTerminal(key.dataType(), key.dataId(), error, maxAttempts, now) > 0) {
            log.error("[{}] Publish attempts exhausted ({}), artifact FAILED: {}", key, maxAttempts, error);
            return Optional.of(LifecycleState.FAILED);
        }
        log.warn("[{}] markFailed ignored; artifact is not PUBLISHING.", key);
        return Optional.empty();
    }

    /**
     * Fails an artifact immediately, whatever its remaining attempts. Used for validation errors, which a
     * retry cannot fix.
     */
    @Transactional
    public boolean markFailedTerminal(ArtifactKey key, String error) {
        int updated = artifactRepository.failImmediately(key.dataType(), key.dataId(), error, ACTIVE_STATES, now());
        if (updated > 0) {
            log.error("[{}] Artifact FAILED without retry: {}", key, error);
        }
        return updated > 0;
    }

    /**
     * Returns a claimed artifact to {@code STAGING} without touching its attempt count. Used when a stage is
     * cancelled and when a crashed worker left the row in {@code PUBLISHING}.
     */
    @Transactional
    public boolean revertToStaging(ArtifactKey key) {
        int updated = artifactRepository.transition(key.dataType(), key.dataId(), LifecycleState.PUBLISHING,
                                                    LifecycleState.STAGING, now());
        if (updated > 0) {
            log.info("[{}] Artifact reverted from PUBLISHING to STAGING.", key);
        }
        return updated > 0;
    }

    /**
     * Operator action: gives a {@code FAILED} artifact a fresh set of publish attempts.
     */
    @Transactional
    public boolean resetForReplay(ArtifactKey key) {
        int updated = artifactRepository.resetForReplay(key.dataType(), key.dataId(), now());
        if (updated > 0) {
            log.info("[{}] Artifact reset from FAILED to STAGING for replay.", key);
        }
        return updated > 0;
    }

    @Transactional(readOnly = true)
    public Optional<Artifact> find(ArtifactKey key) {
        return artifactRepository.findByDataTypeAndDataId(key.dataType(), key.dataId());
    }

    @Transactional(readOnly = true)
    public Optional<Artifact> findByPath(DataType dataType, String stagePath) {
        return artifactRepository.findFirstByDataTypeAndStagePath(dataType, stagePath);
    }

    @Transactional(readOnly = true)
    public Artifact get(ArtifactKey key) {
        return find(key).orElseThrow(() -> new ArtifactNotFoundException("Artifact not found: " + key));
    }

    @Transactional(readOnly = true)
    public List<Artifact> query(ArtifactQuery filter) {
        Specification<Artifact> specification = (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getDataType() != null) {
                predicates.add(cb.equal(root.get("dataType"), filter.getDataType()));
            }
            if (filter.getLifecycleState() != null) {
                predicates.add(cb.equal(root.get("lifecycleState"), filter.getLifecycleState()));
            }
            if (StringUtils.hasText(filter.getDataIdContains())) {
                predicates.add(cb.like(root.get("dataId"), "%" + filter.getDataIdContains() + "%"));
            }
            if (filter.getCreatedAfter() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), filter.getCreatedAfter()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
        PageRequest page = PageRequest.of(0, filter.getLimit(), Sort.by(Sort.Direction.DESC, "createdAt"));
        return artifactRepository.findAll(specification, page).getContent();
    }

    /**
     * Records that {@code child} was derived from {@code parent}. Linking the same pair twice is a no-op.
     */
    @Transactional
    public void link(ArtifactKey parent, ArtifactKey child, String relation) {
        if (relationRepository.existsByParentTypeAndParentIdAndChildTypeAndChildId(
                parent.dataType(), parent.dataId(), child.dataType(), child.dataId())) {
            return;
        }
        try {
            atomicService.attemptToLink(ArtifactRelation.builder()
                                                .parentType(parent.dataType())
                                                .parentId(parent.dataId())
                                                .childType(child.dataType())
                                                .childId(child.dataId())
                                                .relation(relation)
                                                .build());
        } catch (DataIntegrityViolationException e) {
            log.debug("Relation {} -> {} already recorded by a concurrent caller.", parent, child);
        }
    }

    @Transactional(readOnly = true)
    public ArtifactLineage lineage(ArtifactKey key) {
        get(key);
        List<ArtifactLineage.Edge> parents = relationRepository
                .findAllByChildTypeAndChildId(key.dataType(), key.dataId()).stream()
                .map(r -> new ArtifactLineage.Edge(new ArtifactKey(r.getParentType(), r.getParentId()),
                                                   r.getRelation()))
                .toList();
        List<ArtifactLineage.Edge> children = relationRepository
                .findAllByParentTypeAndParentId(key.dataType(), key.dataId()).stream()
                .map(r -> new ArtifactLineage.Edge(new ArtifactKey(r.getChildType(), r.getChildId()),
                                                   r.getRelation()))
                .toList();
        return new ArtifactLineage(key, parents, children);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
