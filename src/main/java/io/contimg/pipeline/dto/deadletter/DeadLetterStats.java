package io.contimg.pipeline.dto.deadletter;

import java.util.Map;

/**
 * Queue totals by status, with the pending entries broken down by reason and by component.
 */
public record DeadLetterStats(long pending, long replayed, long resolved,
                              Map<String, Long> pendingByReason, Map<String, Long> pendingByComponent) {
}
