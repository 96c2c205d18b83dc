package io.contimg.pipeline.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Thrown without invoking the protected operation while its circuit breaker is open.
 */
@Getter
public class CircuitBreakerOpenException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String breakerName;

    public CircuitBreakerOpenException(String breakerName) {
        super("Circuit breaker '" + breakerName + "' is open; call rejected.");
        this.breakerName = breakerName;
    }
}
