package io.contimg.pipeline.service.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.contimg.pipeline.common.json.jackson.JacksonJsonParser;
import io.contimg.pipeline.common.json.jackson.JacksonJsonSerializer;
import io.contimg.pipeline.common.processexec.ProcessExecutor;
import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.exception.TransientProcessingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommandLineImagingEngineTest {

    private static final EngineRequest IMAGE_REQUEST =
            new EngineRequest("image", List.of("/stage/obs.cal.ms"), Map.of("niter", 1000));

    @Mock
    private ProcessExecutor processExecutor;

    @Captor
    private ArgumentCaptor<List<String>> command;

    private final PipelineConfig pipelineConfig = new PipelineConfig();
    private CommandLineImagingEngine engine;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        engine = new CommandLineImagingEngine(processExecutor, new JacksonJsonSerializer(objectMapper),
                                              new JacksonJsonParser(objectMapper), pipelineConfig);
    }

    @Test
    void passesTheRequestAsJsonAndReadsTheProduct() throws Exception {
        givenProcessResult(0, """
                {"status":"ok","outputPath":"/stage/obs.image.fits",
                 "metrics":{"peakFlux":1.5,"rmsNoise":0.01,"extras":{"ra_min":10.0}},
                 "products":{"residual":"/stage/obs.residual.fits"},"engineVersion":"2.1"}
                """, "");

        EngineResult result = engine.invoke(IMAGE_REQUEST);

        assertThat(result).isInstanceOf(EngineResult.Success.class);
        EngineResult.Success success = (EngineResult.Success) result;
        assertThat(success.outputPath()).isEqualTo("/stage/obs.image.fits");
        assertThat(success.metrics().snr()).isEqualTo(150.0);
        assertThat(success.products()).containsEntry("residual", "/stage/obs.residual.fits");

        verify(processExecutor).execute(command.capture(), anyString(), any(Duration.class), anyString());
        assertThat(command.getValue()).startsWith("contimg-engine", "image", "--request");
        assertThat(command.getValue().get(3)).contains("\"inputs\":[\"/stage/obs.cal.ms\"]").contains("\"niter\":1000");
    }

    @Test
    void productRolesReportedAsNullAreLeftOut() throws Exception {
        givenProcessResult(0, """
                {"status":"ok","outputPath":"/stage/obs.cal.ms",
                 "products":{"caltable":null,"residual":"/stage/obs.residual.fits"}}
                """, "");

        EngineResult result = engine.invoke(IMAGE_REQUEST);

        assertThat(result).isInstanceOf(EngineResult.Success.class);
        assertThat(((EngineResult.Success) result).products())
                .containsExactly(Map.entry("residual", "/stage/obs.residual.fits"));
    }

    @Test
    void reportedFailureKeepsTheEnginesClassification() throws Exception {
        givenProcessResult(0, "{\"status\":\"error\",\"errorCode\":\"LICENSE\",\"retryable\":true}", "");
        assertThat(engine.invoke(IMAGE_REQUEST))
                .isEqualTo(new EngineResult.Failure(EngineResult.FailureKind.TRANSIENT, "LICENSE", null));

        givenProcessResult(0, "{\"status\":\"error\",\"errorCode\":\"CORRUPT\",\"errorMessage\":\"bad uvw\"}", "");
        assertThat(engine.invoke(IMAGE_REQUEST))
                .isEqualTo(new EngineResult.Failure(EngineResult.FailureKind.PERMANENT, "CORRUPT", "bad uvw"));
    }

    @Test
    void exitCodesAreClassified() throws Exception {
        givenProcessResult(75, "", "resource busy");
        assertThat(engine.invoke(IMAGE_REQUEST))
                .isEqualTo(new EngineResult.Failure(EngineResult.FailureKind.TRANSIENT, "EXIT_75", "resource busy"));

        givenProcessResult(2, "", "");
        assertThat(engine.invoke(IMAGE_REQUEST))
                .isEqualTo(new EngineResult.Failure(EngineResult.FailureKind.PERMANENT, "EXIT_2", "exit code 2"));
    }

    @Test
    void timeoutIsTransient() throws Exception {
        when(processExecutor.execute(anyList(), anyString(), any(Duration.class), anyString()))
                .thenThrow(new ProcessExecutor.ProcessTimeoutException("engine-image timed out"));

        EngineResult result = engine.invoke(IMAGE_REQUEST);

        assertThat(result).isInstanceOf(EngineResult.Failure.class);
        assertThat(((EngineResult.Failure) result).kind()).isEqualTo(EngineResult.FailureKind.TRANSIENT);
        assertThat(((EngineResult.Failure) result).code()).isEqualTo("TIMEOUT");
    }

    @Test
    void unreadableResponseIsPermanent() throws Exception {
        givenProcessResult(0, "Segmentation fault", "");

        EngineResult result = engine.invoke(IMAGE_REQUEST);

        assertThat(((EngineResult.Failure) result).kind()).isEqualTo(EngineResult.FailureKind.PERMANENT);
        assertThat(((EngineResult.Failure) result).code()).isEqualTo("BAD_RESPONSE");
    }

    @Test
    void imagePlaneNullsBecomeBlankedPixels() throws Exception {
        givenProcessResult(0, "{\"width\":2,\"height\":2,\"pixels\":[1.0,null,3.0,4.0]}", "");

        ImagePlane plane = engine.readImagePlane("/stage/obs.image.fits");

        assertThat(plane.width()).isEqualTo(2);
        assertThat(plane.pixels()).containsExactly(1.0, Double.NaN, 3.0, 4.0);
    }

    @Test
    void failedPlaneReadIsTransient() throws Exception {
        givenProcessResult(1, "", "no such file");

        assertThatThrownBy(() -> engine.readImagePlane("/stage/missing.fits"))
                .isInstanceOf(TransientProcessingException.class)
                .hasMessageContaining("exit code 1");
    }

    private void givenProcessResult(int exitCode, String stdout, String stderr) throws Exception {
        when(processExecutor.execute(anyList(), anyString(), any(Duration.class), anyString()))
                .thenReturn(new ProcessExecutor.ProcessResult(exitCode, stdout, stderr));
    }
}
