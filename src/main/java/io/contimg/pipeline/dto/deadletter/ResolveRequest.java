package io.contimg.pipeline.dto.deadletter;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@Schema(description = "Closes a dead letter without replaying it.")
public class ResolveRequest {

    @NotBlank(message = "'resolvedBy' must name the operator closing the entry.")
    @Schema(description = "Operator closing the entry.", example = "jdoe")
    private String resolvedBy;

    @Schema(description = "Free-text explanation of the resolution.", nullable = true)
    private String notes;
}
