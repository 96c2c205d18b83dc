package io.contimg.pipeline.model;

/**
 * Why an operation was parked in the dead-letter queue.
 */
public enum DeadLetterReason {
    RETRIES_EXHAUSTED,
    NON_RETRYABLE_ERROR,
    CIRCUIT_OPEN,
    TIMEOUT,
    INVALID_DATA,
    MANUAL_REJECTION
}
