package io.contimg.pipeline.service.registry;

import io.contimg.pipeline.model.Artifact;
import io.contimg.pipeline.model.ArtifactRelation;
import io.contimg.pipeline.repository.ArtifactRelationRepository;
import io.contimg.pipeline.repository.ArtifactRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts that may race with another worker. Each runs in its own transaction so a unique-key
 * collision only rolls back the insert, never the caller's surrounding work.
 */
@Service
@RequiredArgsConstructor
public class ArtifactAtomicService {

    private final ArtifactRepository artifactRepository;
    private final ArtifactRelationRepository relationRepository;

    /**
     * Attempts to create a new artifact row.
     *
     * @param artifact the new artifact, in STAGING
     * @return the saved artifact with its generated id
     * @throws DataIntegrityViolationException if another worker registered the same type and id first
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Artifact attemptToCreate(Artifact artifact) throws DataIntegrityViolationException {
        return artifactRepository.saveAndFlush(artifact);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ArtifactRelation attemptToLink(ArtifactRelation relation) throws DataIntegrityViolationException {
        return relationRepository.saveAndFlush(relation);
    }
}
