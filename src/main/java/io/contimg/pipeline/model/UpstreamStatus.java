package io.contimg.pipeline.model;

/**
 * The processing status of an indexed file as seen by the group detector.
 */
public enum UpstreamStatus {
    ARRIVED,
    CONVERTED,
    IMAGED,
    /**
     * The file has been emitted as part of a group and must not be detected again.
     */
    GROUPED,
    /**
     * The file never became part of a complete group before the maximum age elapsed.
     */
    ABANDONED
}
