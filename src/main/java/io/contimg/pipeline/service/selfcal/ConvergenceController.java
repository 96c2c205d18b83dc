package io.contimg.pipeline.service.selfcal;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.exception.ValidationException;
import io.contimg.pipeline.service.engine.EngineGateway;
import io.contimg.pipeline.service.engine.EngineResult;
import io.contimg.pipeline.service.engine.QualityMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives iterative self-calibration and decides after every iteration whether to continue.
 * <p>
 * The run images the calibrated data once (the baseline), then walks a schedule of progressively shorter
 * phase-only solution intervals followed by one amplitude+phase pass. Each iteration starts from the best data
 * so far. An iteration that raises the SNR becomes the new best; the loop continues only while the gain is at
 * least the configured ratio, and also stops on divergence, excessive flagging or a failed iteration.
 * <p>
 * Failures of the baseline propagate to the caller. Failures of later iterations end the run with the best
 * iteration so far.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConvergenceController {

    static final String IMAGE_OPERATION = "image";
    static final String SELFCAL_OPERATION = "selfcal";

    private final EngineGateway engineGateway;
    private final PipelineConfig pipelineConfig;

    public ConvergenceResult run(String contextId, String calibratedPath) {
        return run(contextId, calibratedPath, pipelineConfig.getSelfcal());
    }

    public ConvergenceResult run(String contextId, String calibratedPath, PipelineConfig.SelfCal config) {
        List<IterationRecord> iterations = new ArrayList<>();

        EngineResult.Success baselineResult = engineGateway.invoke(contextId, IMAGE_OPERATION, List.of(calibratedPath),
                                                                   Map.of("purpose", "selfcal-baseline"));
        QualityMetrics baselineMetrics = baselineResult.metrics();
        double baselineSnr = baselineMetrics.snr();
        if (Double.isNaN(baselineSnr)) {
            throw new ValidationException("Baseline image of " + calibratedPath + " reported no usable peak/rms");
        }
        IterationRecord best = new IterationRecord(0, CalibrationMode.BASELINE, null, baselineSnr,
                                                   baselineMetrics.dynamicRange(), baselineMetrics.peakFlux(),
                                                   baselineMetrics.rmsNoise(), orZero(baselineMetrics.flaggedFraction()),
                                                   1.0, baselineResult.outputPath(), null, calibratedPath, true);
        iterations.add(best);
        log.info("[{}] Self-cal baseline: SNR={}, DR={}", contextId, fmt(baselineSnr), fmt(best.dynamicRange()));

        if (baselineSnr < config.getMinInitialSnr()) {
            String reason = String.format("Initial SNR (%.1f) below minimum (%.1f)", baselineSnr,
                                          config.getMinInitialSnr());
            log.warn("[{}] {}; skipping self-calibration.", contextId, reason);
            return new ConvergenceResult(false, best, iterations, StopReason.INITIAL_SNR_TOO_LOW, reason);
        }

        List<ScheduledSolve> schedule = buildSchedule(config);
        StopReason stopReason = StopReason.MAX_ITERATIONS;
        String reason = "Completed " + schedule.size() + " scheduled iteration(s)";

        for (int i = 0; i < schedule.size(); i++) {
            int iteration = i + 1;
            ScheduledSolve solve = schedule.get(i);
            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("iteration", iteration);
            parameters.put("calmode", solve.mode().engineCode());
            parameters.put("solint", solve.solint());
            if (best.calTablePath() != null) {
                parameters.put("previousCaltable", best.calTablePath());
            }

            EngineResult.Success result;
            try {
                result = engineGateway.invoke(contextId, SELFCAL_OPERATION, List.of(best.calibratedPath()), parameters);
            } catch (RuntimeException e) {
                stopReason = StopReason.ITERATION_FAILED;
                reason = "Iteration " + iteration + " failed: " + e.getMessage();
                log.warn("[{}] {}", contextId, reason);
                break;
            }

            QualityMetrics metrics = result.metrics();
            double snr = metrics.snr();
            double ratio = Double.isNaN(snr) ? 0.0 : snr / best.snr();
            double flagged = orZero(metrics.flaggedFraction());
            boolean excessiveFlagging = flagged > config.getMaxFlaggedFraction();
            boolean diverged = !excessiveFlagging && config.isStopOnDivergence()
                    && (Double.isNaN(snr) || snr < config.getDivergenceFraction() * best.snr());
            boolean accepted = !excessiveFlagging && !diverged && snr > best.snr();
            boolean continuing = accepted && ratio >= config.getMinSnrImprovement();

            IterationRecord record = new IterationRecord(iteration, solve.mode(), solve.solint(), snr,
                                                         metrics.dynamicRange(), orNaN(metrics.peakFlux()),
                                                         orNaN(metrics.rmsNoise()), flagged, ratio,
                                                         result.products().get("image"),
                                                         result.products().get("caltable"), result.outputPath(),
                                                         accepted);
            iterations.add(record);
            log.info("[{}] Self-cal iteration {} ({}, solint={}): SNR={}, ratio={}, flagged={}", contextId, iteration,
                     solve.mode(), solve.solint(), fmt(snr), fmt(ratio), fmt(flagged));

            if (excessiveFlagging) {
                stopReason = StopReason.EXCESSIVE_FLAGGING;
                reason = String.format("Iteration %d flagged %.2f of the data (max %.2f)", iteration, flagged,
                                       config.getMaxFlaggedFraction());
                break;
            }
            if (diverged) {
                stopReason = StopReason.DIVERGED;
                reason = String.format("Iteration %d SNR %.1f fell below %.2f x best %.1f", iteration, snr,
                                       config.getDivergenceFraction(), best.snr());
                break;
            }
            if (accepted) {
                best = record;
            }
            if (!continuing) {
                stopReason = StopReason.CONVERGED;
                reason = String.format("SNR improvement %.3f below threshold %.3f at iteration %d", ratio,
                                       config.getMinSnrImprovement(), iteration);
                break;
            }
        }

        boolean refined = best.iterationNumber() > 0;
        boolean floorReached = best.snr() >= config.getQualityFloorSnr();
        if (refined && !floorReached && (stopReason == StopReason.MAX_ITERATIONS
                || stopReason == StopReason.CONVERGED)) {
            stopReason = StopReason.QUALITY_FLOOR_NOT_REACHED;
            reason = String.format("Best SNR %.1f never reached the floor %.1f", best.snr(),
                                   config.getQualityFloorSnr());
        }
        boolean success = refined && floorReached;
        log.info("[{}] Self-cal finished: success={}, stop={}, best iteration {} (SNR {}). {}", contextId, success,
                 stopReason, best.iterationNumber(), fmt(best.snr()), reason);
        return new ConvergenceResult(success, best, iterations, stopReason, reason);
    }

    static List<ScheduledSolve> buildSchedule(PipelineConfig.SelfCal config) {
        List<ScheduledSolve> schedule = new ArrayList<>();
        for (String solint : config.getPhaseSolints()) {
            schedule.add(new ScheduledSolve(CalibrationMode.PHASE, solint));
        }
        if (config.isAmplitudePass()) {
            schedule.add(new ScheduledSolve(CalibrationMode.AMPLITUDE_PHASE, config.getAmplitudeSolint()));
        }
        if (schedule.size() > config.getMaxIterations()) {
            return List.copyOf(schedule.subList(0, Math.max(0, config.getMaxIterations())));
        }
        return schedule;
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }

    private static double orNaN(Double value) {
        return value == null ? Double.NaN : value;
    }

    private static String fmt(double value) {
        return String.format("%.2f", value);
    }

    record ScheduledSolve(CalibrationMode mode, String solint) {
    }
}
