package io.contimg.pipeline.model;

import java.util.Objects;

/**
 * The natural key of an {@link Artifact}: a data id is unique within its data type.
 *
 * @param dataType the artifact type
 * @param dataId   the type-scoped identifier, usually a path or composite key
 */
public record ArtifactKey(DataType dataType, String dataId) {

    public ArtifactKey {
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(dataId, "dataId");
    }

    /**
     * The name under which the lock manager guards side effects on this artifact.
     */
    public String lockName() {
        return "artifact:" + dataType + ":" + dataId;
    }

    /**
     * Parses the {@code TYPE:id} form produced by {@link #toString()}.
     */
    public static ArtifactKey parse(String value) {
        int separator = value.indexOf(':');
        if (separator <= 0) {
            throw new IllegalArgumentException("Artifact key must look like TYPE:id but was '" + value + "'");
        }
        return new ArtifactKey(DataType.valueOf(value.substring(0, separator)), value.substring(separator + 1));
    }

    @Override
    public String toString() {
        return dataType + ":" + dataId;
    }
}
