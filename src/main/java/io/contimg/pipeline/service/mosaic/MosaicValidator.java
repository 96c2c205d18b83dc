package io.contimg.pipeline.service.mosaic;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.service.engine.ImagePlane;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Checks a combined image for coverage gaps, uneven noise, negative bowls and outlier pixels. Noise figures are
 * robust (1.4826 x median absolute deviation) so that bright sources do not inflate them.
 */
@Slf4j
@Component
public class MosaicValidator {

    private static final double MAD_TO_SIGMA = 1.4826;
    private static final int MIN_PIXELS_PER_CELL = 16;

    public MosaicValidationReport validate(ImagePlane plane, PipelineConfig.Mosaic.Validation config) {
        List<String> issues = new ArrayList<>();
        double[] finite = Arrays.stream(plane.pixels()).filter(Double::isFinite).toArray();

        double coverage = (double) finite.length / plane.pixels().length;
        if (coverage < config.getMinCoverageFraction()) {
            issues.add(String.format("Coverage %.2f below minimum %.2f", coverage, config.getMinCoverageFraction()));
        }
        if (finite.length == 0) {
            issues.add("Mosaic has no valid pixels");
            return new MosaicValidationReport(coverage, Double.NaN, false, 0.0, issues);
        }

        double rmsRatio = gridRmsRatio(plane, config.getGridSize());
        if (rmsRatio > config.getMaxRmsRatio()) {
            issues.add(String.format("Regional RMS max/min ratio %.2f exceeds %.2f", rmsRatio, config.getMaxRmsRatio()));
        }

        double[] sorted = finite.clone();
        Arrays.sort(sorted);
        double median = median(sorted);
        double rms = robustRms(sorted, median);

        boolean bowl = rms > 0 && sorted[0] < median - config.getBowlSigma() * rms;
        if (bowl) {
            issues.add(String.format("Negative bowl: minimum %.4g is below -%.1f sigma (sigma %.4g)", sorted[0],
                                     config.getBowlSigma(), rms));
        }

        double outlierFraction = 0.0;
        if (rms > 0) {
            long outliers = Arrays.stream(finite)
                    .filter(v -> Math.abs(v - median) > config.getOutlierSigma() * rms)
                    .count();
            outlierFraction = (double) outliers / finite.length;
            if (outlierFraction > config.getMaxOutlierFraction()) {
                issues.add(String.format("Outlier pixel fraction %.4f exceeds %.4f", outlierFraction,
                                         config.getMaxOutlierFraction()));
            }
        }

        MosaicValidationReport report = new MosaicValidationReport(coverage, rmsRatio, bowl, outlierFraction, issues);
        if (!report.passed()) {
            log.warn("Mosaic validation raised {} issue(s): {}", issues.size(), issues);
        }
        return report;
    }

    /**
     * Ratio of the noisiest to the quietest grid cell. Cells with too few valid pixels are skipped; fewer than
     * two usable cells gives 1.0.
     */
    static double gridRmsRatio(ImagePlane plane, int gridSize) {
        int cells = Math.max(1, gridSize);
        double maxRms = 0.0;
        double minRms = Double.POSITIVE_INFINITY;
        int usable = 0;
        for (int gy = 0; gy < cells; gy++) {
            for (int gx = 0; gx < cells; gx++) {
                int x0 = gx * plane.width() / cells;
                int x1 = (gx + 1) * plane.width() / cells;
                int y0 = gy * plane.height() / cells;
                int y1 = (gy + 1) * plane.height() / cells;
                double[] cell = new double[Math.max(0, (x1 - x0) * (y1 - y0))];
                int n = 0;
                for (int y = y0; y < y1; y++) {
                    for (int x = x0; x < x1; x++) {
                        double v = plane.get(x, y);
                        if (Double.isFinite(v)) {
                            cell[n++] = v;
                        }
                    }
                }
                if (n < MIN_PIXELS_PER_CELL) {
                    continue;
                }
                double[] values = Arrays.copyOf(cell, n);
                Arrays.sort(values);
                double rms = robustRms(values, median(values));
                if (rms <= 0) {
                    continue;
                }
                usable++;
                maxRms = Math.max(maxRms, rms);
                minRms = Math.min(minRms, rms);
            }
        }
        return usable < 2 ? 1.0 : maxRms / minRms;
    }

    static double median(double[] sorted) {
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    static double robustRms(double[] sorted, double median) {
        double[] deviations = new double[sorted.length];
        for (int i = 0; i < sorted.length; i++) {
            deviations[i] = Math.abs(sorted[i] - median);
        }
        Arrays.sort(deviations);
        return MAD_TO_SIGMA * median(deviations);
    }
}
