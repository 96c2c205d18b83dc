package io.contimg.pipeline.service.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
