package io.contimg.pipeline.repository;

import io.contimg.pipeline.model.Artifact;
import io.contimg.pipeline.model.DataType;
import io.contimg.pipeline.model.LifecycleState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link Artifact} entity.
 * JPQL queries are defined in META-INF/pipeline-orm.xml. Every lifecycle transition is a single conditional
 * UPDATE; a return value of zero means the expected state did not hold and nothing changed.
 */
@Repository
public interface ArtifactRepository extends JpaRepository<Artifact, Long>, JpaSpecificationExecutor<Artifact> {

    Optional<Artifact> findByDataTypeAndDataId(DataType dataType, String dataId);

    Optional<Artifact> findFirstByDataTypeAndStagePath(DataType dataType, String stagePath);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "Artifact.transition")
    int transition(@Param("dataType") DataType dataType, @Param("dataId") String dataId,
                   @Param("fromState") LifecycleState fromState, @Param("toState") LifecycleState toState,
                   @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "Artifact.updateMetadata")
    int updateMetadata(@Param("dataType") DataType dataType, @Param("dataId") String dataId,
                       @Param("metadata") Map<String, Object> metadata, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "Artifact.updateStagePath")
    int updateStagePath(@Param("dataType") DataType dataType, @Param("dataId") String dataId,
                        @Param("stagePath") String stagePath, @Param("states") Collection<LifecycleState> states,
                        @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "Artifact.claimForPublishing")
    int claimForPublishing(@Param("dataType") DataType dataType, @Param("dataId") String dataId,
                           @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "Artifact.failToStaging")
    int failToStaging(@Param("dataType") DataType dataType, @Param("dataId") String dataId,
                      @Param("error") String error, @Param("maxAttempts") int maxAttempts,
                      @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "Artifact.failTerminal")
    int failTerminal(@Param("dataType") DataType dataType, @Param("dataId") String dataId,
                     @Param("error") String error, @Param("maxAttempts") int maxAttempts,
                     @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "Artifact.failImmediately")
    int failImmediately(@Param("dataType") DataType dataType, @Param("dataId") String dataId,
                        @Param("error") String error, @Param("activeStates") List<LifecycleState> activeStates,
                        @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "Artifact.resetForReplay")
    int resetForReplay(@Param("dataType") DataType dataType, @Param("dataId") String dataId,
                       @Param("now") LocalDateTime now);
}
