package io.contimg.pipeline.service.engine;

import io.contimg.pipeline.common.json.JsonParser;
import io.contimg.pipeline.common.json.JsonSerializer;
import io.contimg.pipeline.common.processexec.ProcessExecutor;
import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.exception.TransientProcessingException;
import io.contimg.pipeline.exception.ValidationException;
import io.contimg.pipeline.exception.json.JsonParsingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the engine as an external command: {@code <command> <operation> --request <json>}. The command prints
 * one JSON document on stdout. Exit codes listed as transient, and timeouts, are reported as transient
 * failures; any other non-zero exit is permanent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandLineImagingEngine implements ImagingEngine {

    private final ProcessExecutor processExecutor;
    private final JsonSerializer jsonSerializer;
    private final JsonParser jsonParser;
    private final PipelineConfig pipelineConfig;

    @Override
    public EngineResult invoke(EngineRequest request) {
        PipelineConfig.Engine config = pipelineConfig.getEngine();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("inputs", request.artifactPaths());
        payload.put("parameters", request.parameters());

        List<String> command = new ArrayList<>(config.getCommand());
        command.add(request.operation());
        command.add("--request");
        command.add(jsonSerializer.serialize(payload));

        ProcessExecutor.ProcessResult result;
        try {
            result = processExecutor.execute(command, request.operation(), config.getProcessTimeout(),
                                             "engine-" + request.operation());
        } catch (ProcessExecutor.ProcessTimeoutException e) {
            return EngineResult.transientFailure("TIMEOUT", e.getMessage());
        } catch (IOException e) {
            return EngineResult.transientFailure("IO_ERROR", "Could not run engine: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EngineResult.transientFailure("INTERRUPTED", "Interrupted while waiting for the engine");
        }

        if (result.exitCode() != 0) {
            String message = StringUtils.hasText(result.stderr()) ? result.stderr() : "exit code " + result.exitCode();
            if (config.getTransientExitCodes().contains(result.exitCode())) {
                return EngineResult.transientFailure("EXIT_" + result.exitCode(), message);
            }
            return EngineResult.permanentFailure("EXIT_" + result.exitCode(), message);
        }
        return toResult(request.operation(), result.stdout());
    }

    private EngineResult toResult(String operation, String stdout) {
        EngineResponse.Invocation response;
        try {
            response = jsonParser.parseObject(stdout, EngineResponse.Invocation.class);
        } catch (JsonParsingException e) {
            log.error("[{}] Engine printed an unreadable response: {}", operation, stdout);
            return EngineResult.permanentFailure("BAD_RESPONSE", e.getMessage());
        }
        if (!response.isOk()) {
            EngineResult.FailureKind kind = Boolean.TRUE.equals(response.getRetryable())
                    ? EngineResult.FailureKind.TRANSIENT
                    : EngineResult.FailureKind.PERMANENT;
            return new EngineResult.Failure(kind, response.getErrorCode(), response.getErrorMessage());
        }
        return new EngineResult.Success(response.getOutputPath(), response.getMetrics(), response.getProducts());
    }

    @Override
    @Retryable(retryFor = TransientProcessingException.class,
               maxAttemptsExpression = "#{${app.pipeline.engine.read-retry-attempts:3}}",
               backoff = @Backoff(delayExpression = "#{${app.pipeline.engine.read-retry-delay-ms:500}}"),
               listeners = {"engineReadRetryListener"})
    public ImagePlane readImagePlane(String path) {
        PipelineConfig.Engine config = pipelineConfig.getEngine();
        List<String> command = new ArrayList<>(config.getCommand());
        command.add("read-plane");
        command.add("--path");
        command.add(path);

        ProcessExecutor.ProcessResult result;
        try {
            result = processExecutor.execute(command, path, config.getProcessTimeout(), "engine-read-plane");
        } catch (IOException e) {
            throw new TransientProcessingException("Could not read image plane of " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientProcessingException("Interrupted while reading image plane of " + path, e);
        }
        if (result.exitCode() != 0) {
            throw new TransientProcessingException(
                    "Reading image plane of " + path + " failed with exit code " + result.exitCode());
        }

        EngineResponse.Plane plane = jsonParser.parseObject(result.stdout(), EngineResponse.Plane.class);
        if (plane.getPixels() == null) {
            throw new ValidationException("Engine returned no pixels for " + path);
        }
        double[] pixels = new double[plane.getPixels().size()];
        for (int i = 0; i < pixels.length; i++) {
            Double value = plane.getPixels().get(i);
            pixels[i] = value == null ? Double.NaN : value;
        }
        return new ImagePlane(plane.getWidth(), plane.getHeight(), pixels);
    }

    @Recover
    public ImagePlane recover(TransientProcessingException e, String path) {
        log.error("[{}] Reading image plane failed after all retry attempts.", path, e);
        throw new TransientProcessingException("Image plane of " + path + " unreadable after retries", e);
    }
}
