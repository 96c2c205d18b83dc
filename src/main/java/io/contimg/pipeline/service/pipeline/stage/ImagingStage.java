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

import java.util.Map;

/**
 * Images a calibrated unit. The engine reports the image footprint ({@code ra_min} .. {@code dec_max}) and noise
 * statistics, which the mosaic stage later reads back from the artifact metadata.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImagingStage implements StageFunction {

    static final String OPERATION = "image";

    private final EngineGateway engineGateway;

    @Override
    public PipelineStage stage() {
        return PipelineStage.IMAGE;
    }

    @Override
    public StageOutput execute(StageInvocation invocation) {
        EngineResult.Success result = engineGateway.invoke(invocation.groupId(), OPERATION, invocation.inputPaths(),
                                                           Map.of("groupId", invocation.groupId(),
                                                                  "purpose", "science"));
        log.info("[{}] Imaged into '{}' (SNR {}).", invocation.groupId(), result.outputPath(),
                 result.metrics().snr());
        return new StageOutput(result.outputPath(), invocation.withProvenance(result.metrics().toMetadata()));
    }
}
