package io.contimg.pipeline.exception;

import java.io.Serial;

/**
 * Signals that a stage invocation was cancelled by its timeout. Cancellation is not a failure:
 * the artifact goes back to staging for a later attempt.
 */
public class StageCancelledException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 1L;

    public StageCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
