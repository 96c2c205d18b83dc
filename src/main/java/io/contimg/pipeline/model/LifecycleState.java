package io.contimg.pipeline.model;

/**
 * Lifecycle of an {@link Artifact}. Transitions only move forward
 * ({@code STAGING -> PUBLISHING -> PUBLISHED}) except on an explicit failure,
 * which either returns the artifact to {@code STAGING} for another attempt or parks it in {@code FAILED}.
 */
public enum LifecycleState {
    /**
     * The artifact is known but not yet claimed by a worker.
     */
    STAGING,
    /**
     * A worker has claimed the artifact and is producing or moving it.
     */
    PUBLISHING,
    /**
     * The artifact is complete and visible to downstream consumers.
     */
    PUBLISHED,
    /**
     * Terminal failure. Only an operator replay moves the artifact out of this state.
     */
    FAILED
}
