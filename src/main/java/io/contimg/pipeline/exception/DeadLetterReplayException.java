package io.contimg.pipeline.exception;

import java.io.Serial;

/**
 * Thrown when an operator replay or resolution request cannot be honoured.
 */
public class DeadLetterReplayException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 1L;

    public DeadLetterReplayException(String message) {
        super(message);
    }
}
