package io.contimg.pipeline.exception;

import java.io.Serial;

public class ArtifactNotFoundException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 1L;

    public ArtifactNotFoundException(String message) {
        super(message);
    }
}
