package io.contimg.pipeline.exception;

import lombok.Getter;

import java.io.Serial;
import java.time.Duration;

/**
 * Thrown when a lock could not be acquired within its timeout. Callers retry at a higher level.
 */
@Getter
public class LockTimeoutException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String resourceName;

    public LockTimeoutException(String resourceName, Duration timeout) {
        super(String.format("Could not acquire lock '%s' within %d ms.", resourceName, timeout.toMillis()));
        this.resourceName = resourceName;
    }
}
