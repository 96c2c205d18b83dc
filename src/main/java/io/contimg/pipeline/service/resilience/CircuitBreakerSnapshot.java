package io.contimg.pipeline.service.resilience;

import java.time.Instant;

/**
 * Point-in-time view of one breaker, for the operator API and logs.
 */
public record CircuitBreakerSnapshot(String name, CircuitState state, int consecutiveFailures,
                                     Instant openedAt, long rejectedCalls) {
}
