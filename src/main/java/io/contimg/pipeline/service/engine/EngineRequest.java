package io.contimg.pipeline.service.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One call into the imaging/calibration engine.
 *
 * @param operation     engine operation, e.g. {@code convert} or {@code selfcal}
 * @param artifactPaths input data, in the order the operation expects
 * @param parameters    operation parameters, passed to the engine as JSON
 */
public record EngineRequest(String operation, List<String> artifactPaths, Map<String, Object> parameters) {

    public EngineRequest {
        artifactPaths = List.copyOf(artifactPaths);
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
