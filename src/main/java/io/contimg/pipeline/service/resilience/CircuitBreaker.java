package io.contimg.pipeline.service.resilience;

import io.contimg.pipeline.exception.CircuitBreakerOpenException;
import io.contimg.pipeline.exception.TransientProcessingException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Guards one class of operation against a failing dependency.
 * <p>
 * After {@code failureThreshold} consecutive transient failures the breaker opens and every call fails fast
 * with {@link CircuitBreakerOpenException} without reaching the dependency. Once {@code cooldown} has passed a
 * single trial call is let through: success closes the breaker, failure re-opens it. Calls arriving while the
 * trial is in flight are rejected.
 * <p>
 * Only {@link TransientProcessingException} (directly or as a cause) counts as a failure. Any other outcome
 * means the dependency answered, and resets the failure count.
 */
@Slf4j
public class CircuitBreaker {

    @Getter
    private final String name;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean trialInFlight;
    private final AtomicLong rejectedCalls = new AtomicLong();

    public CircuitBreaker(String name, int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * Runs {@code call} if the breaker admits it.
     *
     * @throws CircuitBreakerOpenException if the breaker is open or a half-open trial is already running
     */
    public <T> T execute(Supplier<T> call) {
        boolean trial = admit();
        try {
            T result = call.get();
            onSuccess(trial);
            return result;
        } catch (RuntimeException | Error e) {
            if (isCountedFailure(e)) {
                onFailure(trial, e);
            } else {
                onSuccess(trial);
            }
            throw e;
        }
    }

    private synchronized boolean admit() {
        if (state == CircuitState.OPEN) {
            if (Duration.between(openedAt, clock.instant()).compareTo(cooldown) >= 0) {
                state = CircuitState.HALF_OPEN;
                log.info("Circuit breaker '{}' half-open after {} cooldown; admitting one trial call.", name,
                         cooldown);
            } else {
                rejectedCalls.incrementAndGet();
                throw new CircuitBreakerOpenException(name);
            }
        }
        if (state == CircuitState.HALF_OPEN) {
            if (trialInFlight) {
                rejectedCalls.incrementAndGet();
                throw new CircuitBreakerOpenException(name);
            }
            trialInFlight = true;
            return true;
        }
        return false;
    }

    private synchronized void onSuccess(boolean trial) {
        if (trial) {
            trialInFlight = false;
            state = CircuitState.CLOSED;
            openedAt = null;
            log.info("Circuit breaker '{}' trial call succeeded; breaker CLOSED.", name);
        }
        consecutiveFailures = 0;
    }

    private synchronized void onFailure(boolean trial, Throwable failure) {
        consecutiveFailures++;
        if (trial) {
            trialInFlight = false;
            open();
            log.warn("Circuit breaker '{}' trial call failed ({}); breaker re-OPENED.", name, failure.getMessage());
        } else if (state == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
            open();
            log.warn("Circuit breaker '{}' OPENED after {} consecutive failures.", name, consecutiveFailures);
        }
    }

    private void open() {
        state = CircuitState.OPEN;
        openedAt = clock.instant();
    }

    private static boolean isCountedFailure(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TransientProcessingException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(name, state, consecutiveFailures, openedAt, rejectedCalls.get());
    }

    public synchronized void reset() {
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
        trialInFlight = false;
        rejectedCalls.set(0);
    }
}
