package io.contimg.pipeline.service.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of an engine call: either produced output or a classified failure.
 */
public sealed interface EngineResult permits EngineResult.Success, EngineResult.Failure {

    enum FailureKind {
        TRANSIENT,
        PERMANENT
    }

    /**
     * @param outputPath primary product of the operation
     * @param metrics    statistics of the product
     * @param products   secondary products by role, e.g. {@code caltable} or {@code image}
     */
    record Success(String outputPath, QualityMetrics metrics, Map<String, String> products)
            implements EngineResult {

        public Success {
            metrics = metrics == null ? QualityMetrics.EMPTY : metrics;
            products = products == null ? Map.of() : withoutBlankRoles(products);
        }

        public Success(String outputPath, QualityMetrics metrics) {
            this(outputPath, metrics, Map.of());
        }

        // An engine reports a role it did not produce as null.
        private static Map<String, String> withoutBlankRoles(Map<String, String> products) {
            Map<String, String> present = new LinkedHashMap<>();
            products.forEach((role, path) -> {
                if (role != null && path != null) {
                    present.put(role, path);
                }
            });
            return Collections.unmodifiableMap(present);
        }
    }

    record Failure(FailureKind kind, String code, String message) implements EngineResult {
    }

    static Success success(String outputPath, QualityMetrics metrics) {
        return new Success(outputPath, metrics);
    }

    static Failure transientFailure(String code, String message) {
        return new Failure(FailureKind.TRANSIENT, code, message);
    }

    static Failure permanentFailure(String code, String message) {
        return new Failure(FailureKind.PERMANENT, code, message);
    }
}
