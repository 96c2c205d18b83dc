package io.contimg.pipeline.exception;

import java.io.Serial;

/**
 * A permanent failure: malformed input, impossible coordinate overlap, a missing precursor artifact.
 * Never retried.
 */
public class ValidationException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 6101873265524470155L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
