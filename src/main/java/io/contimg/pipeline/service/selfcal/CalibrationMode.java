package io.contimg.pipeline.service.selfcal;

/**
 * What a self-calibration solve is allowed to correct.
 */
public enum CalibrationMode {
    /**
     * The initial image, before any self-calibration.
     */
    BASELINE("none"),
    PHASE("p"),
    AMPLITUDE_PHASE("ap");

    private final String engineCode;

    CalibrationMode(String engineCode) {
        this.engineCode = engineCode;
    }

    public String engineCode() {
        return engineCode;
    }
}
