package io.contimg.pipeline.service.selfcal;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final outcome of a self-calibration run. A run that did not succeed still carries its best iteration, which
 * is the baseline when no refinement was accepted.
 */
public record ConvergenceResult(boolean success, IterationRecord bestIteration, List<IterationRecord> iterations,
                                StopReason stopReason, String reason) {

    public ConvergenceResult {
        iterations = List.copyOf(iterations);
    }

    public int acceptedRefinements() {
        return (int) iterations.stream().filter(r -> r.iterationNumber() > 0 && r.accepted()).count();
    }

    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("selfcal_success", success);
        metadata.put("selfcal_stop_reason", stopReason.name());
        metadata.put("selfcal_reason", reason);
        metadata.put("selfcal_iterations", iterations.size() - 1);
        if (bestIteration != null) {
            metadata.put("selfcal_best_iteration", bestIteration.iterationNumber());
            metadata.put("selfcal_best_snr", bestIteration.snr());
            if (!iterations.isEmpty()) {
                metadata.put("selfcal_initial_snr", iterations.get(0).snr());
            }
        }
        return metadata;
    }
}
