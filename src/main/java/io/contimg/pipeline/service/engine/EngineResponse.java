package io.contimg.pipeline.service.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * JSON documents the engine command prints on stdout.
 */
final class EngineResponse {

    private EngineResponse() {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Invocation {
        private String status;
        private String outputPath;
        private QualityMetrics metrics;
        private Map<String, String> products;
        private String errorCode;
        private String errorMessage;
        private Boolean retryable;

        boolean isOk() {
            return "ok".equalsIgnoreCase(status);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Plane {
        private int width;
        private int height;
        /**
         * Row-major pixels; JSON null marks a blanked pixel.
         */
        private List<Double> pixels;
    }
}
