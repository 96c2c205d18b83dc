package io.contimg.pipeline.service.mosaic;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Post-combination checks of a mosaic. Issues are warnings; the mosaic is published regardless.
 */
public record MosaicValidationReport(double coverageFraction, double rmsUniformityRatio, boolean negativeBowl,
                                     double outlierFraction, List<String> issues) {

    public MosaicValidationReport {
        issues = List.copyOf(issues);
    }

    public boolean passed() {
        return issues.isEmpty();
    }

    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("qa_status", passed() ? "pass" : "warn");
        metadata.put("qa_coverage_fraction", coverageFraction);
        metadata.put("qa_rms_uniformity_ratio", rmsUniformityRatio);
        metadata.put("qa_negative_bowl", negativeBowl);
        metadata.put("qa_outlier_fraction", outlierFraction);
        if (!issues.isEmpty()) {
            metadata.put("qa_warnings", issues);
        }
        return metadata;
    }
}
