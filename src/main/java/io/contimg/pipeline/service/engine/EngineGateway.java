package io.contimg.pipeline.service.engine;

import io.contimg.pipeline.exception.TransientProcessingException;
import io.contimg.pipeline.exception.ValidationException;
import io.contimg.pipeline.service.resilience.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

/**
 * The only way pipeline code talks to the {@link ImagingEngine}. Each engine operation is guarded by its own
 * circuit breaker, and engine failures are turned into the pipeline's exception taxonomy: transient failures
 * become {@link TransientProcessingException}, permanent ones {@link ValidationException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngineGateway {

    private final ImagingEngine imagingEngine;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public EngineResult.Success invoke(String contextId, String operation, List<String> inputs,
                                       Map<String, Object> parameters) {
        EngineRequest request = new EngineRequest(operation, inputs, parameters);
        return circuitBreakerRegistry.get(breakerName(operation)).execute(() -> {
            log.debug("[{}] Invoking engine '{}' on {} input(s).", contextId, operation, inputs.size());
            EngineResult result = imagingEngine.invoke(request);
            if (result instanceof EngineResult.Failure failure) {
                String message = String.format("Engine '%s' failed (%s): %s", operation, failure.code(),
                                               failure.message());
                if (failure.kind() == EngineResult.FailureKind.TRANSIENT) {
                    log.warn("[{}] {}", contextId, message);
                    throw new TransientProcessingException(message);
                }
                log.error("[{}] {}", contextId, message);
                throw new ValidationException(message);
            }
            EngineResult.Success success = (EngineResult.Success) result;
            if (!StringUtils.hasText(success.outputPath())) {
                throw new ValidationException("Engine '" + operation + "' reported success without an output path");
            }
            return success;
        });
    }

    public ImagePlane readImagePlane(String contextId, String path) {
        return circuitBreakerRegistry.get(breakerName("read-plane")).execute(() -> {
            log.debug("[{}] Reading image plane of '{}'.", contextId, path);
            return imagingEngine.readImagePlane(path);
        });
    }

    static String breakerName(String operation) {
        return "engine." + operation;
    }
}
