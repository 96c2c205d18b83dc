package io.contimg.pipeline.repository;

import io.contimg.pipeline.model.ResourceLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;

/**
 * Spring Data JPA repository for {@link ResourceLock} rows.
 * JPQL queries are defined in META-INF/pipeline-orm.xml.
 */
@Repository
public interface ResourceLockRepository extends JpaRepository<ResourceLock, String> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "ResourceLock.release")
    int release(@Param("resourceName") String resourceName, @Param("holderId") String holderId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "ResourceLock.heartbeat")
    int heartbeat(@Param("resourceNames") Collection<String> resourceNames, @Param("holderId") String holderId,
                  @Param("now") LocalDateTime now);

    /**
     * Deletes the lock only if it is still exactly the record the sweeper inspected, so a lock that was
     * released and re-acquired in the meantime is left alone.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "ResourceLock.reclaim")
    int reclaim(@Param("resourceName") String resourceName, @Param("holderId") String holderId,
                @Param("heartbeatAt") LocalDateTime heartbeatAt);
}
