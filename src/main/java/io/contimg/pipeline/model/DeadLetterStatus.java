package io.contimg.pipeline.model;

public enum DeadLetterStatus {
    /**
     * Awaiting operator attention.
     */
    PENDING,
    /**
     * An operator re-submitted the operation as a fresh stage invocation.
     */
    REPLAYED,
    /**
     * An operator closed the entry without replaying it.
     */
    RESOLVED
}
