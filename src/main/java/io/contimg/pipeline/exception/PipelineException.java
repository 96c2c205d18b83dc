package io.contimg.pipeline.exception;

import java.io.Serial;

/**
 * Base exception for errors raised while moving data through the processing pipeline.
 */
public class PipelineException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
