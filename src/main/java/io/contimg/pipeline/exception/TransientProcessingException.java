package io.contimg.pipeline.exception;

import java.io.Serial;

/**
 * A failure that is expected to clear on its own: I/O timeouts, a busy engine, a flaky network mount.
 * Only this family of errors is retried by the resilience layer.
 */
public class TransientProcessingException extends PipelineException {
    @Serial
    private static final long serialVersionUID = -2716475380012237491L;

    public TransientProcessingException(String message) {
        super(message);
    }

    public TransientProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
