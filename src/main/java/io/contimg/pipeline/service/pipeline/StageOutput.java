package io.contimg.pipeline.service.pipeline;

import io.contimg.pipeline.model.ArtifactKey;

import java.util.List;
import java.util.Map;

/**
 * What a stage produced: the primary output and any secondary artifacts published with it.
 */
public record StageOutput(String path, Map<String, Object> metadata, List<AuxiliaryOutput> auxiliary) {

    public StageOutput {
        metadata = metadata == null ? Map.of() : metadata;
        auxiliary = auxiliary == null ? List.of() : List.copyOf(auxiliary);
    }

    public StageOutput(String path, Map<String, Object> metadata) {
        this(path, metadata, List.of());
    }

    public record AuxiliaryOutput(ArtifactKey key, String path, Map<String, Object> metadata) {
    }
}
