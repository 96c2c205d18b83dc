package io.contimg.pipeline.service.resilience;

import io.contimg.pipeline.dto.deadletter.DeadLetterQuery;
import io.contimg.pipeline.dto.deadletter.DeadLetterStats;
import io.contimg.pipeline.exception.DeadLetterReplayException;
import io.contimg.pipeline.exception.TransientProcessingException;
import io.contimg.pipeline.exception.ValidationException;
import io.contimg.pipeline.model.DeadLetterEntry;
import io.contimg.pipeline.model.DeadLetterReason;
import io.contimg.pipeline.model.DeadLetterStatus;
import io.contimg.pipeline.support.PipelineIntegrationSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeadLetterQueueServiceTest extends PipelineIntegrationSupport {

    @Autowired
    private DeadLetterQueueService deadLetterQueue;

    @Test
    void addRecordsTheErrorAndContext() {
        DeadLetterEntry entry = deadLetterQueue.add("pipeline-stage-runner", "IMAGE", DeadLetterReason.INVALID_DATA,
                                                    new ValidationException("corrupt table"),
                                                    Map.of("groupId", "obs_1"), 1);

        DeadLetterEntry stored = deadLetterQueue.get(entry.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(DeadLetterStatus.PENDING);
        assertThat(stored.getErrorType()).isEqualTo("ValidationException");
        assertThat(stored.getErrorMessage()).isEqualTo("corrupt table");
        assertThat(stored.getContext()).containsEntry("groupId", "obs_1");
        assertThat(stored.getCreatedAt()).isNotNull();
    }

    @Test
    void listFiltersByComponentReasonAndStatus() {
        deadLetterQueue.add("pipeline-stage-runner", "IMAGE", DeadLetterReason.INVALID_DATA, null, null, 1);
        deadLetterQueue.add("pipeline-stage-runner", "CONVERT", DeadLetterReason.RETRIES_EXHAUSTED,
                            new TransientProcessingException("busy"), null, 3);
        DeadLetterEntry other = deadLetterQueue.add("group-detector", "emit", DeadLetterReason.NON_RETRYABLE_ERROR,
                                                    null, null, 1);
        deadLetterQueue.resolve(other.getId(), "operator", "known issue");

        assertThat(deadLetterQueue.list(DeadLetterQuery.builder().component("pipeline-stage-runner").build()))
                .hasSize(2);
        assertThat(deadLetterQueue.list(DeadLetterQuery.builder().reason(DeadLetterReason.RETRIES_EXHAUSTED).build()))
                .extracting(DeadLetterEntry::getOperation).containsExactly("CONVERT");
        assertThat(deadLetterQueue.list(DeadLetterQuery.builder().status(DeadLetterStatus.RESOLVED).build()))
                .extracting(DeadLetterEntry::getId).containsExactly(other.getId());
    }

    @Test
    void statsBreakPendingEntriesDown() {
        deadLetterQueue.add("pipeline-stage-runner", "IMAGE", DeadLetterReason.INVALID_DATA, null, null, 1);
        deadLetterQueue.add("pipeline-stage-runner", "IMAGE", DeadLetterReason.INVALID_DATA, null, null, 1);
        DeadLetterEntry replayed = deadLetterQueue.add("pipeline-stage-runner", "CALIBRATE",
                                                       DeadLetterReason.CIRCUIT_OPEN, null, null, 3);
        deadLetterQueue.markReplayed(replayed.getId(), "operator");

        DeadLetterStats stats = deadLetterQueue.stats();

        assertThat(stats.pending()).isEqualTo(2);
        assertThat(stats.replayed()).isEqualTo(1);
        assertThat(stats.resolved()).isZero();
        assertThat(stats.pendingByReason()).containsExactly(Map.entry("INVALID_DATA", 2L));
        assertThat(stats.pendingByComponent()).containsEntry("pipeline-stage-runner", 2L);
        assertThat(deadLetterQueue.countPending()).isEqualTo(2);
    }

    @Test
    void resolveClosesAnEntryOnlyOnce() {
        DeadLetterEntry entry = deadLetterQueue.add("pipeline-stage-runner", "IMAGE", DeadLetterReason.INVALID_DATA,
                                                    null, null, 1);

        deadLetterQueue.resolve(entry.getId(), "operator", "re-observed");

        DeadLetterEntry resolved = deadLetterQueue.get(entry.getId()).orElseThrow();
        assertThat(resolved.getStatus()).isEqualTo(DeadLetterStatus.RESOLVED);
        assertThat(resolved.getResolvedBy()).isEqualTo("operator");
        assertThat(resolved.getResolutionNotes()).isEqualTo("re-observed");
        assertThat(resolved.getResolvedAt()).isNotNull();
        assertThatThrownBy(() -> deadLetterQueue.resolve(entry.getId(), "someone", "again"))
                .isInstanceOf(DeadLetterReplayException.class)
                .hasMessageContaining("no longer pending");
    }

    @Test
    void resolvingAnUnknownEntryFails() {
        assertThatThrownBy(() -> deadLetterQueue.resolve(404L, "operator", null))
                .isInstanceOf(DeadLetterReplayException.class)
                .hasMessageContaining("does not exist");
    }
}
