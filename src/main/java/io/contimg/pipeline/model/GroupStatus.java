package io.contimg.pipeline.model;

public enum GroupStatus {
    EMITTED,
    COMPLETED,
    FAILED,
    ABANDONED
}
