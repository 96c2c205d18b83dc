package io.contimg.pipeline.dto.registry;

import io.contimg.pipeline.model.ArtifactKey;

import java.util.List;

/**
 * Provenance of one artifact: what it was derived from and what was derived from it.
 */
public record ArtifactLineage(ArtifactKey artifact, List<Edge> parents, List<Edge> children) {

    public record Edge(ArtifactKey artifact, String relation) {
    }
}
