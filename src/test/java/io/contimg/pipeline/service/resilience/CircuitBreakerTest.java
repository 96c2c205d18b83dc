package io.contimg.pipeline.service.resilience;

import io.contimg.pipeline.exception.CircuitBreakerOpenException;
import io.contimg.pipeline.exception.TransientProcessingException;
import io.contimg.pipeline.exception.ValidationException;
import io.contimg.pipeline.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-10-02T00:00:00Z"));
        breaker = new CircuitBreaker("engine.image", 3, Duration.ofSeconds(60), clock);
    }

    @Test
    void opensAfterThresholdConsecutiveTransientFailures() {
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> breaker.execute(this::failTransiently))
                    .isInstanceOf(TransientProcessingException.class);
        }

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void openBreakerFailsFastWithoutInvokingTheCall() {
        tripBreaker();
        AtomicInteger invocations = new AtomicInteger();

        assertThatThrownBy(() -> breaker.execute(() -> invocations.incrementAndGet()))
                .isInstanceOf(CircuitBreakerOpenException.class);

        assertThat(invocations).hasValue(0);
        assertThat(breaker.snapshot().rejectedCalls()).isEqualTo(1);
    }

    @Test
    void successInBetweenResetsTheFailureCount() {
        assertThatThrownBy(() -> breaker.execute(this::failTransiently));
        assertThatThrownBy(() -> breaker.execute(this::failTransiently));
        breaker.execute(() -> "ok");
        assertThatThrownBy(() -> breaker.execute(this::failTransiently));
        assertThatThrownBy(() -> breaker.execute(this::failTransiently));

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void permanentFailuresDoNotCountAgainstTheBreaker() {
        for (int i = 0; i < 10; i++) {
            assertThatThrownBy(() -> breaker.execute(() -> {
                throw new ValidationException("bad input");
            })).isInstanceOf(ValidationException.class);
        }

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void wrappedTransientFailureCounts() {
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> breaker.execute(() -> {
                throw new IllegalStateException("wrapper", new TransientProcessingException("busy"));
            }));
        }

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void trialCallAfterCooldownClosesTheBreakerOnSuccess() {
        tripBreaker();
        clock.advance(Duration.ofSeconds(61));

        assertThat(breaker.execute(() -> "recovered")).isEqualTo("recovered");
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void failedTrialCallReopensTheBreaker() {
        tripBreaker();
        clock.advance(Duration.ofSeconds(61));

        assertThatThrownBy(() -> breaker.execute(this::failTransiently))
                .isInstanceOf(TransientProcessingException.class);

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThatThrownBy(() -> breaker.execute(() -> "too early"))
                .isInstanceOf(CircuitBreakerOpenException.class);
    }

    @Test
    void onlyOneTrialCallIsAdmittedWhileHalfOpen() throws Exception {
        tripBreaker();
        clock.advance(Duration.ofSeconds(61));
        CountDownLatch trialStarted = new CountDownLatch(1);
        CountDownLatch releaseTrial = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> trial = executor.submit(() -> breaker.execute(() -> {
                trialStarted.countDown();
                await(releaseTrial);
                return "trial";
            }));
            assertThat(trialStarted.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
            assertThatThrownBy(() -> breaker.execute(() -> "second"))
                    .isInstanceOf(CircuitBreakerOpenException.class);

            releaseTrial.countDown();
            assertThat(trial.get(5, TimeUnit.SECONDS)).isEqualTo("trial");
            assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void resetClosesAnOpenBreaker() {
        tripBreaker();

        breaker.reset();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.snapshot().consecutiveFailures()).isZero();
    }

    private void tripBreaker() {
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> breaker.execute(this::failTransiently));
        }
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
    }

    private String failTransiently() {
        throw new TransientProcessingException("engine busy");
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
