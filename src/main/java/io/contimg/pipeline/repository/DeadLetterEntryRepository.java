package io.contimg.pipeline.repository;

import io.contimg.pipeline.model.DeadLetterEntry;
import io.contimg.pipeline.model.DeadLetterStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Spring Data JPA repository for the dead-letter queue.
 * JPQL queries are defined in META-INF/pipeline-orm.xml.
 */
@Repository
public interface DeadLetterEntryRepository extends JpaRepository<DeadLetterEntry, Long>,
        JpaSpecificationExecutor<DeadLetterEntry> {

    long countByStatus(DeadLetterStatus status);

    @Query(name = "DeadLetterEntry.countByReason")
    List<Object[]> countByReason(@Param("status") DeadLetterStatus status);

    @Query(name = "DeadLetterEntry.countByComponent")
    List<Object[]> countByComponent(@Param("status") DeadLetterStatus status);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "DeadLetterEntry.close")
    int closeIfPending(@Param("id") Long id, @Param("newStatus") DeadLetterStatus newStatus,
                       @Param("resolvedBy") String resolvedBy, @Param("notes") String notes,
                       @Param("now") LocalDateTime now);
}
