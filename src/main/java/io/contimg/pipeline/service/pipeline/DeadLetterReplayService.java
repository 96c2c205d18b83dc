package io.contimg.pipeline.service.pipeline;

import io.contimg.pipeline.exception.DeadLetterReplayException;
import io.contimg.pipeline.model.Artifact;
import io.contimg.pipeline.model.DeadLetterEntry;
import io.contimg.pipeline.model.DeadLetterStatus;
import io.contimg.pipeline.model.LifecycleState;
import io.contimg.pipeline.service.registry.ArtifactRegistryService;
import io.contimg.pipeline.service.resilience.DeadLetterQueueService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Operator replay of a dead-lettered stage: the failed output gets a fresh set of attempts, the entry is closed
 * as {@code REPLAYED}, and the stage (with the rest of its group's stages) is run again in the background.
 */
@Slf4j
@Service
public class DeadLetterReplayService {

    private final DeadLetterQueueService deadLetterQueue;
    private final ArtifactRegistryService registry;
    private final GroupPipelineService groupPipelineService;
    private final AsyncTaskExecutor groupTaskExecutor;

    public DeadLetterReplayService(DeadLetterQueueService deadLetterQueue, ArtifactRegistryService registry,
                                   GroupPipelineService groupPipelineService,
                                   @Qualifier("groupTaskExecutor") AsyncTaskExecutor groupTaskExecutor) {
        this.deadLetterQueue = deadLetterQueue;
        this.registry = registry;
        this.groupPipelineService = groupPipelineService;
        this.groupTaskExecutor = groupTaskExecutor;
    }

    /**
     * @return the stage request that was re-submitted
     * @throws DeadLetterReplayException if the entry is unknown, not pending, not a stage invocation, or its
     *                                   output has been published in the meantime
     */
    public StageRequest replay(Long id, String replayedBy) {
        DeadLetterEntry entry = deadLetterQueue.get(id)
                .orElseThrow(() -> new DeadLetterReplayException("Dead letter " + id + " does not exist"));
        if (entry.getStatus() != DeadLetterStatus.PENDING) {
            throw new DeadLetterReplayException("Dead letter " + id + " is " + entry.getStatus() + ", not PENDING");
        }
        if (!PipelineStageRunner.COMPONENT.equals(entry.getComponent())) {
            throw new DeadLetterReplayException("Dead letter " + id + " from '" + entry.getComponent()
                                                + "' cannot be replayed; resolve it instead");
        }
        StageRequest request = StageRequest.fromContext(entry.getContext());

        Optional<Artifact> output = registry.find(request.output());
        if (output.isPresent() && output.get().getLifecycleState() == LifecycleState.PUBLISHED) {
            throw new DeadLetterReplayException("Output " + request.output() + " is already PUBLISHED; resolve "
                                                + "dead letter " + id + " instead");
        }
        if (output.isPresent() && output.get().getLifecycleState() == LifecycleState.FAILED) {
            registry.resetForReplay(request.output());
        }
        deadLetterQueue.markReplayed(id, replayedBy);
        log.info("[{}] Replaying {} of group {} for '{}'.", id, request.stage(), request.groupId(), replayedBy);

        CompletableFuture.supplyAsync(() -> rerun(request), groupTaskExecutor)
                .whenComplete((artifact, error) -> {
                    if (error != null) {
                        log.error("[{}] Replay of {} failed.", id, request.output(), error);
                    } else if (artifact != null) {
                        log.info("[{}] Replay of {} ended with {} in {}.", id, request.output(), artifact.key(),
                                 artifact.getLifecycleState());
                    }
                });
        return request;
    }

    private Artifact rerun(StageRequest request) {
        if (GroupPipelineService.SUBBAND_STAGES.contains(request.stage())) {
            return groupPipelineService.continueSubbandGroup(request);
        }
        return groupPipelineService.continueMosaicGroup(request);
    }
}
