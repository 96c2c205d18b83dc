package io.contimg.pipeline.service.pipeline.stage;

import io.contimg.pipeline.service.engine.EngineGateway;
import io.contimg.pipeline.service.engine.EngineResult;
import io.contimg.pipeline.service.pipeline.PipelineStage;
import io.contimg.pipeline.service.pipeline.StageFunction;
import io.contimg.pipeline.service.pipeline.StageInvocation;
import io.contimg.pipeline.service.pipeline.StageOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts the raw subband files of a group into one visibility unit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversionStage implements StageFunction {

    static final String OPERATION = "convert";

    private final EngineGateway engineGateway;

    @Override
    public PipelineStage stage() {
        return PipelineStage.CONVERT;
    }

    @Override
    public StageOutput execute(StageInvocation invocation) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("groupId", invocation.groupId());
        parameters.put("subbandCount", invocation.inputs().size());

        EngineResult.Success result = engineGateway.invoke(invocation.groupId(), OPERATION,
                                                           invocation.inputPaths(), parameters);
        Map<String, Object> metadata = new LinkedHashMap<>(result.metrics().toMetadata());
        metadata.put("subband_count", invocation.inputs().size());
        log.info("[{}] Converted {} subband(s) into '{}'.", invocation.groupId(), invocation.inputs().size(),
                 result.outputPath());
        return new StageOutput(result.outputPath(), invocation.withProvenance(metadata));
    }
}
