package io.contimg.pipeline.dto.deadletter;

import io.contimg.pipeline.model.DeadLetterReason;
import io.contimg.pipeline.model.DeadLetterStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterQuery {

    private String component;
    private DeadLetterReason reason;
    private DeadLetterStatus status;
    private LocalDateTime since;

    @Min(1)
    @Max(1000)
    @Builder.Default
    private int limit = 100;
}
