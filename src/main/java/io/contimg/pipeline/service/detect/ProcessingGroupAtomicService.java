package io.contimg.pipeline.service.detect;

import io.contimg.pipeline.model.IncomingFile;
import io.contimg.pipeline.model.ProcessingGroup;
import io.contimg.pipeline.repository.IncomingFileRepository;
import io.contimg.pipeline.repository.ProcessingGroupRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ProcessingGroupAtomicService {

    private final ProcessingGroupRepository processingGroupRepository;
    private final IncomingFileRepository incomingFileRepository;

    /**
     * Inserts the emission record in its own transaction.
     *
     * @throws DataIntegrityViolationException if a group with the same id was already recorded
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ProcessingGroup attemptToCreate(ProcessingGroup group) throws DataIntegrityViolationException {
        return processingGroupRepository.saveAndFlush(group);
    }

    /**
     * @throws DataIntegrityViolationException if the path is already indexed
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IncomingFile attemptToIndex(IncomingFile file) throws DataIntegrityViolationException {
        return incomingFileRepository.saveAndFlush(file);
    }
}
