package io.contimg.pipeline.service.resilience;

import io.contimg.pipeline.config.PipelineConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link CircuitBreaker} per operation class, created on first use from the configured threshold and
 * cooldown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CircuitBreakerRegistry {

    private final PipelineConfig pipelineConfig;
    private final Clock clock;

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreaker get(String name) {
        return breakers.computeIfAbsent(name, key -> {
            PipelineConfig.CircuitBreaker config = pipelineConfig.getCircuitBreaker();
            log.debug("Creating circuit breaker '{}' (threshold={}, cooldown={}).", key,
                      config.getFailureThreshold(), config.getCooldown());
            return new CircuitBreaker(key, config.getFailureThreshold(), config.getCooldown(), clock);
        });
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerSnapshot::name))
                .toList();
    }

    /**
     * Forgets all breakers; the next call for any operation starts from a fresh, closed breaker.
     */
    public void reset() {
        log.info("Resetting {} circuit breaker(s).", breakers.size());
        breakers.clear();
    }
}
