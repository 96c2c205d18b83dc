package io.contimg.pipeline.dto.registry;

import io.contimg.pipeline.model.DataType;
import io.contimg.pipeline.model.LifecycleState;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Filter for registry queries. Every criterion is optional; unset criteria match everything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Filter for artifact registry queries.")
public class ArtifactQuery {

    @Schema(description = "Restrict to one artifact type.", example = "IMAGE", nullable = true)
    private DataType dataType;

    @Schema(description = "Restrict to one lifecycle state.", example = "PUBLISHED", nullable = true)
    private LifecycleState lifecycleState;

    @Schema(description = "Substring the data id must contain.", nullable = true)
    private String dataIdContains;

    @Schema(description = "Only artifacts created at or after this instant.", nullable = true)
    private LocalDateTime createdAfter;

    @Min(1)
    @Max(1000)
    @Builder.Default
    private int limit = 100;
}
