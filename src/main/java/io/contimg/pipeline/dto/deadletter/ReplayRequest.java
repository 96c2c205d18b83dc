package io.contimg.pipeline.dto.deadletter;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@Schema(description = "Re-submits a dead-lettered stage as a fresh invocation.")
public class ReplayRequest {

    @NotBlank(message = "'replayedBy' must name the operator requesting the replay.")
    @Schema(description = "Operator requesting the replay.", example = "jdoe")
    private String replayedBy;
}
