package io.contimg.pipeline.service.resilience;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.exception.TransientProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.function.IntFunction;

/**
 * Retries transient failures with exponential backoff. Only {@link TransientProcessingException}, thrown
 * directly or wrapped as a cause, is retried; every other exception propagates on its first occurrence.
 */
@Slf4j
@Component
public class RetryExecutor {

    private final RetryTemplate retryTemplate;
    private final int maxAttempts;

    public RetryExecutor(PipelineConfig pipelineConfig, StageRetryListener stageRetryListener) {
        PipelineConfig.Retry retry = pipelineConfig.getRetry();
        this.maxAttempts = retry.getMaxRetries() + 1;
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(retry.getInitialDelay().toMillis(), retry.getMultiplier(),
                                    retry.getMaxDelay().toMillis(), retry.isJitter())
                .retryOn(TransientProcessingException.class)
                .traversingCauses()
                .withListener(stageRetryListener)
                .build();
        log.info("Retry policy: {} attempt(s), backoff {} x{} up to {}, jitter={}.", maxAttempts,
                 retry.getInitialDelay(), retry.getMultiplier(), retry.getMaxDelay(), retry.isJitter());
    }

    /**
     * Runs {@code body}, retrying it on transient failure. The body receives the 1-based attempt number.
     *
     * @throws RuntimeException the last failure once attempts are exhausted, or the first non-retryable one
     */
    public <T> T execute(String operation, IntFunction<T> body) {
        return retryTemplate.execute(context -> {
            context.setAttribute(StageRetryListener.OPERATION_ATTRIBUTE, operation);
            return body.apply(context.getRetryCount() + 1);
        });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
