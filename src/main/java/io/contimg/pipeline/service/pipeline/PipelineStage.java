package io.contimg.pipeline.service.pipeline;

import io.contimg.pipeline.model.DataType;
import lombok.Getter;

/**
 * The fixed stage topology. Subband groups run {@code CONVERT -> CALIBRATE -> IMAGE}; mosaic groups run
 * {@code COMBINE}.
 */
@Getter
public enum PipelineStage {
    CONVERT(DataType.RAW_UNIT, DataType.CONVERTED_UNIT),
    CALIBRATE(DataType.CONVERTED_UNIT, DataType.CALIBRATED_UNIT),
    IMAGE(DataType.CALIBRATED_UNIT, DataType.IMAGE),
    COMBINE(DataType.IMAGE, DataType.MOSAIC);

    private final DataType inputType;
    private final DataType outputType;

    PipelineStage(DataType inputType, DataType outputType) {
        this.inputType = inputType;
        this.outputType = outputType;
    }
}
