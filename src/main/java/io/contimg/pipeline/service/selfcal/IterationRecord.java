package io.contimg.pipeline.service.selfcal;

/**
 * Outcome of one self-calibration iteration. Iteration 0 is the baseline image.
 *
 * @param improvementRatio SNR of this iteration over the best SNR before it; 1.0 for the baseline
 * @param calibratedPath   data with this iteration's solutions applied
 * @param accepted         whether this iteration became the new best
 */
public record IterationRecord(int iterationNumber, CalibrationMode calibrationMode, String solutionInterval,
                              double snr, double dynamicRange, double peakFlux, double rmsNoise,
                              double flaggedFraction, double improvementRatio, String imagePath,
                              String calTablePath, String calibratedPath, boolean accepted) {
}
