package io.contimg.pipeline.repository;

import io.contimg.pipeline.model.FileKind;
import io.contimg.pipeline.model.GroupStatus;
import io.contimg.pipeline.model.ProcessingGroup;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProcessingGroupRepository extends JpaRepository<ProcessingGroup, Long> {

    Optional<ProcessingGroup> findByGroupId(String groupId);

    List<ProcessingGroup> findByKindOrderByCreatedAtDesc(FileKind kind, Pageable pageable);

    List<ProcessingGroup> findByStatusOrderByCreatedAtDesc(GroupStatus status, Pageable pageable);

    List<ProcessingGroup> findByStatusAndKindOrderByCreatedAtDesc(GroupStatus status, FileKind kind,
                                                                  Pageable pageable);

    List<ProcessingGroup> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
