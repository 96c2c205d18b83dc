package io.contimg.pipeline.exception.json;

import io.contimg.pipeline.exception.PipelineException;

import java.io.Serial;

/**
 * Thrown when a JSON document cannot be read or written.
 */
public class JsonParsingException extends PipelineException {
    @Serial
    private static final long serialVersionUID = -4315221486898941505L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
