package io.contimg.pipeline.service.selfcal;

public enum StopReason {
    MAX_ITERATIONS,
    CONVERGED,
    DIVERGED,
    EXCESSIVE_FLAGGING,
    ITERATION_FAILED,
    QUALITY_FLOOR_NOT_REACHED,
    INITIAL_SNR_TOO_LOW
}
