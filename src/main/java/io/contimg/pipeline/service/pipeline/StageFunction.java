package io.contimg.pipeline.service.pipeline;

/**
 * The work of one stage. Implementations talk to the engine and report what they produced; all registry
 * bookkeeping, locking, retrying and timeouts are done around them by the {@link PipelineStageRunner}.
 * <p>
 * Throw {@link io.contimg.pipeline.exception.TransientProcessingException} for failures worth retrying and
 * {@link io.contimg.pipeline.exception.ValidationException} for failures that a retry cannot fix.
 */
public interface StageFunction {

    PipelineStage stage();

    StageOutput execute(StageInvocation invocation);
}
