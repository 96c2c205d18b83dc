package io.contimg.pipeline.repository;

import io.contimg.pipeline.model.ArtifactRelation;
import io.contimg.pipeline.model.DataType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ArtifactRelationRepository extends JpaRepository<ArtifactRelation, Long> {

    boolean existsByParentTypeAndParentIdAndChildTypeAndChildId(DataType parentType, String parentId,
                                                                DataType childType, String childId);

    List<ArtifactRelation> findAllByChildTypeAndChildId(DataType childType, String childId);

    List<ArtifactRelation> findAllByParentTypeAndParentId(DataType parentType, String parentId);
}
