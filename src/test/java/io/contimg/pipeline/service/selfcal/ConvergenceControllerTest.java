package io.contimg.pipeline.service.selfcal;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.exception.TransientProcessingException;
import io.contimg.pipeline.service.engine.EngineGateway;
import io.contimg.pipeline.service.engine.EngineResult;
import io.contimg.pipeline.service.engine.QualityMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConvergenceControllerTest {

    private static final String CONTEXT = "obs_2025-10-02T00:12:00/CALIBRATE";
    private static final String CALIBRATED = "/stage/obs.cal.ms";

    @Mock
    private EngineGateway engineGateway;

    private PipelineConfig pipelineConfig;
    private ConvergenceController controller;

    @BeforeEach
    void setUp() {
        pipelineConfig = new PipelineConfig();
        controller = new ConvergenceController(engineGateway, pipelineConfig);
    }

    @Test
    void stopsWhenImprovementFallsBelowThresholdAndKeepsTheBest() {
        givenBaselineSnr(20);
        givenIterations(iteration(1, 30, 0.1), iteration(2, 31, 0.1));

        ConvergenceResult result = controller.run(CONTEXT, CALIBRATED);

        assertThat(result.success()).isTrue();
        assertThat(result.stopReason()).isEqualTo(StopReason.CONVERGED);
        assertThat(result.iterations()).hasSize(3);
        assertThat(result.bestIteration().iterationNumber()).isEqualTo(2);
        assertThat(result.bestIteration().calTablePath()).isEqualTo("/cal/iter2.tb");
        assertThat(result.acceptedRefinements()).isEqualTo(2);
    }

    @Test
    void lowInitialSnrSkipsSelfCalibration() {
        givenBaselineSnr(5);

        ConvergenceResult result = controller.run(CONTEXT, CALIBRATED);

        assertThat(result.success()).isFalse();
        assertThat(result.stopReason()).isEqualTo(StopReason.INITIAL_SNR_TOO_LOW);
        assertThat(result.bestIteration().iterationNumber()).isZero();
        assertThat(result.bestIteration().calibratedPath()).isEqualTo(CALIBRATED);
        verify(engineGateway, never()).invoke(any(), eq(ConvergenceController.SELFCAL_OPERATION), anyList(), anyMap());
    }

    @Test
    void divergenceStopsTheRunWithThePreviousBest() {
        givenBaselineSnr(20);
        givenIterations(iteration(1, 30, 0.1), iteration(2, 20, 0.1));

        ConvergenceResult result = controller.run(CONTEXT, CALIBRATED);

        assertThat(result.stopReason()).isEqualTo(StopReason.DIVERGED);
        assertThat(result.success()).isTrue();
        assertThat(result.bestIteration().iterationNumber()).isEqualTo(1);
        assertThat(result.iterations().get(2).accepted()).isFalse();
    }

    @Test
    void excessiveFlaggingRejectsTheIterationEvenWithHigherSnr() {
        givenBaselineSnr(20);
        givenIterations(iteration(1, 40, 0.6));

        ConvergenceResult result = controller.run(CONTEXT, CALIBRATED);

        assertThat(result.stopReason()).isEqualTo(StopReason.EXCESSIVE_FLAGGING);
        assertThat(result.success()).isFalse();
        assertThat(result.bestIteration().iterationNumber()).isZero();
    }

    @Test
    void failedFirstIterationIsNeverASuccess() {
        givenBaselineSnr(20);
        when(engineGateway.invoke(eq(CONTEXT), eq(ConvergenceController.SELFCAL_OPERATION), anyList(), anyMap()))
                .thenThrow(new TransientProcessingException("engine busy"));

        ConvergenceResult result = controller.run(CONTEXT, CALIBRATED);

        assertThat(result.success()).isFalse();
        assertThat(result.stopReason()).isEqualTo(StopReason.ITERATION_FAILED);
        assertThat(result.bestIteration().iterationNumber()).isZero();
    }

    @Test
    void runsTheWholeScheduleWhileEveryIterationImproves() {
        givenBaselineSnr(20);
        givenIterations(iteration(1, 30, 0.1), iteration(2, 45, 0.1), iteration(3, 67.5, 0.1),
                        iteration(4, 101.25, 0.1));

        ConvergenceResult result = controller.run(CONTEXT, CALIBRATED);

        assertThat(result.stopReason()).isEqualTo(StopReason.MAX_ITERATIONS);
        assertThat(result.bestIteration().iterationNumber()).isEqualTo(4);
        assertThat(result.iterations()).extracting(IterationRecord::calibrationMode)
                .containsExactly(CalibrationMode.BASELINE, CalibrationMode.PHASE, CalibrationMode.PHASE,
                                 CalibrationMode.PHASE, CalibrationMode.AMPLITUDE_PHASE);
        assertThat(result.iterations()).extracting(IterationRecord::snr).isSorted();
    }

    @Test
    void laterIterationsStartFromTheBestSolutions() {
        givenBaselineSnr(20);
        givenIterations(iteration(1, 30, 0.1), iteration(2, 31, 0.1));

        controller.run(CONTEXT, CALIBRATED);

        verify(engineGateway).invoke(eq(CONTEXT), eq(ConvergenceController.SELFCAL_OPERATION),
                                     eq(List.of("/cal/iter1.ms")),
                                     argThat(parameters -> "/cal/iter1.tb".equals(parameters.get("previousCaltable"))
                                             && Integer.valueOf(2).equals(parameters.get("iteration"))));
    }

    @Test
    void qualityFloorTurnsAConvergedRunIntoAFailure() {
        pipelineConfig.getSelfcal().setQualityFloorSnr(100);
        givenBaselineSnr(20);
        givenIterations(iteration(1, 30, 0.1), iteration(2, 31, 0.1));

        ConvergenceResult result = controller.run(CONTEXT, CALIBRATED);

        assertThat(result.success()).isFalse();
        assertThat(result.stopReason()).isEqualTo(StopReason.QUALITY_FLOOR_NOT_REACHED);
        assertThat(result.bestIteration().iterationNumber()).isEqualTo(2);
    }

    @Test
    void baselineFailurePropagates() {
        when(engineGateway.invoke(eq(CONTEXT), eq(ConvergenceController.IMAGE_OPERATION), anyList(), anyMap()))
                .thenThrow(new TransientProcessingException("engine busy"));

        assertThatThrownBy(() -> controller.run(CONTEXT, CALIBRATED))
                .isInstanceOf(TransientProcessingException.class);
    }

    @Test
    void scheduleIsCappedAtMaxIterations() {
        PipelineConfig.SelfCal config = new PipelineConfig.SelfCal();
        config.setMaxIterations(2);

        assertThat(ConvergenceController.buildSchedule(config))
                .extracting(ConvergenceController.ScheduledSolve::solint)
                .containsExactly("inf", "60s");
    }

    @Test
    void metadataSummarisesTheRun() {
        givenBaselineSnr(20);
        givenIterations(iteration(1, 30, 0.1), iteration(2, 31, 0.1));

        Map<String, Object> metadata = controller.run(CONTEXT, CALIBRATED).toMetadata();

        assertThat(metadata)
                .containsEntry("selfcal_success", true)
                .containsEntry("selfcal_stop_reason", "CONVERGED")
                .containsEntry("selfcal_iterations", 2)
                .containsEntry("selfcal_best_iteration", 2)
                .containsEntry("selfcal_initial_snr", 20.0);
    }

    private void givenBaselineSnr(double snr) {
        when(engineGateway.invoke(eq(CONTEXT), eq(ConvergenceController.IMAGE_OPERATION), anyList(), anyMap()))
                .thenReturn(new EngineResult.Success("/img/baseline.fits", metrics(snr, 0.0)));
    }

    private void givenIterations(EngineResult.Success first, EngineResult.Success... rest) {
        when(engineGateway.invoke(eq(CONTEXT), eq(ConvergenceController.SELFCAL_OPERATION), anyList(), anyMap()))
                .thenReturn(first, rest);
    }

    private static EngineResult.Success iteration(int number, double snr, double flagged) {
        return new EngineResult.Success("/cal/iter" + number + ".ms", metrics(snr, flagged),
                                        Map.of("image", "/img/iter" + number + ".fits",
                                               "caltable", "/cal/iter" + number + ".tb"));
    }

    private static QualityMetrics metrics(double snr, double flagged) {
        return new QualityMetrics(snr, 1.0, null, flagged, null, null);
    }
}
