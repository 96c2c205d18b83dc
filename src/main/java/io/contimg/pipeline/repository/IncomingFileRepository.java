package io.contimg.pipeline.repository;

import io.contimg.pipeline.model.FileKind;
import io.contimg.pipeline.model.IncomingFile;
import io.contimg.pipeline.model.UpstreamStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for the file arrival index.
 * JPQL queries are defined in META-INF/pipeline-orm.xml.
 */
@Repository
public interface IncomingFileRepository extends JpaRepository<IncomingFile, Long> {

    Optional<IncomingFile> findByPath(String path);

    @Query(name = "IncomingFile.findInWindow")
    List<IncomingFile> findInWindow(@Param("kind") FileKind kind, @Param("groupKey") String groupKey,
                                    @Param("start") LocalDateTime start, @Param("end") LocalDateTime end);

    List<IncomingFile> findByKindAndUpstreamStatusAndObservedAtBetween(FileKind kind, UpstreamStatus status,
                                                                        LocalDateTime start, LocalDateTime end);

    List<IncomingFile> findTop500ByKindAndUpstreamStatusOrderByObservedAtAsc(FileKind kind, UpstreamStatus status);

    List<IncomingFile> findByKindAndUpstreamStatusAndReceivedAtBefore(FileKind kind, UpstreamStatus status,
                                                                       LocalDateTime threshold);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "IncomingFile.updateStatusIfExpected")
    int updateStatusIfExpected(@Param("paths") Collection<String> paths, @Param("newStatus") UpstreamStatus newStatus,
                               @Param("expectedStatus") UpstreamStatus expectedStatus);
}
