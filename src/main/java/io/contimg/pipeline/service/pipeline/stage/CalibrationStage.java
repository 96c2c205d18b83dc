package io.contimg.pipeline.service.pipeline.stage;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.model.ArtifactKey;
import io.contimg.pipeline.model.DataType;
import io.contimg.pipeline.service.engine.EngineGateway;
import io.contimg.pipeline.service.engine.EngineResult;
import io.contimg.pipeline.service.pipeline.PipelineStage;
import io.contimg.pipeline.service.pipeline.StageFunction;
import io.contimg.pipeline.service.pipeline.StageInvocation;
import io.contimg.pipeline.service.pipeline.StageOutput;
import io.contimg.pipeline.service.selfcal.ConvergenceController;
import io.contimg.pipeline.service.selfcal.ConvergenceResult;
import io.contimg.pipeline.service.selfcal.IterationRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Solves and applies calibration to a converted unit, then optionally refines it with self-calibration.
 * <p>
 * A self-calibration run that does not succeed is not a stage failure: the unit is published with the
 * initial calibration and the outcome recorded in its metadata.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CalibrationStage implements StageFunction {

    static final String OPERATION = "calibrate";
    static final String CALTABLE_PRODUCT = "caltable";

    private final EngineGateway engineGateway;
    private final ConvergenceController convergenceController;
    private final PipelineConfig pipelineConfig;

    @Override
    public PipelineStage stage() {
        return PipelineStage.CALIBRATE;
    }

    @Override
    public StageOutput execute(StageInvocation invocation) {
        String groupId = invocation.groupId();
        EngineResult.Success result = engineGateway.invoke(groupId, OPERATION, invocation.inputPaths(),
                                                           Map.of("groupId", groupId));
        String calibratedPath = result.outputPath();
        String calTablePath = result.products().get(CALTABLE_PRODUCT);
        Map<String, Object> metadata = new LinkedHashMap<>(result.metrics().toMetadata());

        if (pipelineConfig.getSelfcal().isEnabled()) {
            ConvergenceResult selfcal = convergenceController.run(groupId, calibratedPath);
            metadata.putAll(selfcal.toMetadata());
            if (selfcal.success()) {
                IterationRecord best = selfcal.bestIteration();
                calibratedPath = best.calibratedPath();
                if (best.calTablePath() != null) {
                    calTablePath = best.calTablePath();
                }
                log.info("[{}] Using self-calibrated data from iteration {} (SNR {}).", groupId,
                         best.iterationNumber(), best.snr());
            } else {
                log.info("[{}] Self-calibration did not improve the unit ({}); keeping initial calibration.",
                         groupId, selfcal.stopReason());
            }
        }

        List<StageOutput.AuxiliaryOutput> auxiliary = calTablePath == null ? List.of()
                : List.of(new StageOutput.AuxiliaryOutput(new ArtifactKey(DataType.CALIBRATION_TABLE, groupId),
                                                          calTablePath, Map.of("group_id", groupId)));
        return new StageOutput(calibratedPath, invocation.withProvenance(metadata), auxiliary);
    }
}
