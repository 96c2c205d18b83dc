package io.contimg.pipeline.model;

/**
 * The kinds of data product tracked by the artifact registry.
 */
public enum DataType {
    /**
     * A single raw subband file as delivered by the correlator.
     */
    RAW_UNIT,
    /**
     * A group of subbands converted into one visibility unit.
     */
    CONVERTED_UNIT,
    /**
     * A converted unit with calibration solutions applied.
     */
    CALIBRATED_UNIT,
    IMAGE,
    MOSAIC,
    CALIBRATION_TABLE
}
