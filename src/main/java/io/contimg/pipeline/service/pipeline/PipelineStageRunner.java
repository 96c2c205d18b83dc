package io.contimg.pipeline.service.pipeline;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.exception.CircuitBreakerOpenException;
import io.contimg.pipeline.exception.PipelineException;
import io.contimg.pipeline.exception.StageCancelledException;
import io.contimg.pipeline.exception.TransientProcessingException;
import io.contimg.pipeline.exception.ValidationException;
import io.contimg.pipeline.model.Artifact;
import io.contimg.pipeline.model.ArtifactKey;
import io.contimg.pipeline.model.DeadLetterReason;
import io.contimg.pipeline.model.LifecycleState;
import io.contimg.pipeline.service.lock.LockHandle;
import io.contimg.pipeline.service.lock.LockManager;
import io.contimg.pipeline.service.registry.ArtifactRegistryService;
import io.contimg.pipeline.service.resilience.DeadLetterQueueService;
import io.contimg.pipeline.service.resilience.RetryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one stage for one group at most once.
 * <p>
 * The output artifact is guarded by a lock for the whole run. Under the lock the runner skips outputs that are
 * already settled, claims the output with {@code STAGING -> PUBLISHING}, runs the stage body on the stage
 * executor (retried on transient failure, bounded by the per-stage timeout) and finally publishes the output or
 * records the failure. The returned artifact reflects the state the run left it in.
 */
@Slf4j
@Service
public class PipelineStageRunner {

    static final String COMPONENT = "pipeline-stage-runner";

    private final ArtifactRegistryService registry;
    private final LockManager lockManager;
    private final RetryExecutor retryExecutor;
    private final DeadLetterQueueService deadLetterQueue;
    private final ArtifactPublisher publisher;
    private final PipelineConfig pipelineConfig;
    private final AsyncTaskExecutor stageTaskExecutor;
    private final Map<PipelineStage, StageFunction> stageFunctions = new EnumMap<>(PipelineStage.class);

    public PipelineStageRunner(ArtifactRegistryService registry, LockManager lockManager,
                               RetryExecutor retryExecutor, DeadLetterQueueService deadLetterQueue,
                               ArtifactPublisher publisher, PipelineConfig pipelineConfig,
                               List<StageFunction> functions,
                               @Qualifier("stageTaskExecutor") AsyncTaskExecutor stageTaskExecutor) {
        this.registry = registry;
        this.lockManager = lockManager;
        this.retryExecutor = retryExecutor;
        this.deadLetterQueue = deadLetterQueue;
        this.publisher = publisher;
        this.pipelineConfig = pipelineConfig;
        this.stageTaskExecutor = stageTaskExecutor;
        for (StageFunction function : functions) {
            if (stageFunctions.put(function.stage(), function) != null) {
                throw new IllegalStateException("More than one stage function registered for " + function.stage());
            }
        }
    }

    /**
     * @return the output artifact in the state this run left it: {@code PUBLISHED} on success (or if it already
     * was), {@code STAGING} if it has attempts left, {@code FAILED} otherwise
     * @throws ValidationException     if an input artifact is missing or not yet published
     * @throws StageCancelledException if the stage timed out or the calling thread was interrupted
     */
    public Artifact runStage(StageRequest request) {
        ArtifactKey output = request.output();
        String contextId = contextId(request);
        StageFunction function = stageFunctions.get(request.stage());
        if (function == null) {
            throw new IllegalStateException("No stage function registered for " + request.stage());
        }

        try (LockHandle ignored = lockManager.acquire(output.lockName())) {
            Optional<Artifact> existing = registry.find(output);
            if (existing.isPresent()) {
                LifecycleState state = existing.get().getLifecycleState();
                if (state == LifecycleState.PUBLISHED) {
                    log.info("[{}] Output {} already PUBLISHED; skipping.", contextId, output);
                    return existing.get();
                }
                if (state == LifecycleState.FAILED) {
                    log.warn("[{}] Output {} is FAILED; it runs again only after an operator replay.", contextId,
                             output);
                    return existing.get();
                }
            }

            List<Artifact> inputs = resolveInputs(request, contextId);

            registry.register(output, null, Map.of("stage", request.stage().name()));
            if (existing.isPresent() && existing.get().getLifecycleState() == LifecycleState.PUBLISHING) {
                // Nobody else can be working on it while we hold the lock.
                log.warn("[{}] Recovering orphaned PUBLISHING row of {}.", contextId, output);
                registry.revertToStaging(output);
            }
            if (!registry.markPublishing(output)) {
                log.warn("[{}] Could not claim {} for publishing; leaving it as is.", contextId, output);
                return registry.get(output);
            }

            try {
                StageOutput produced = invoke(function, request, inputs, contextId);
                return publish(request, inputs, produced, contextId);
            } catch (StageCancelledException e) {
                registry.revertToStaging(output);
                throw e;
            } catch (RuntimeException e) {
                return recordFailure(request, e, contextId);
            }
        }
    }

    private List<Artifact> resolveInputs(StageRequest request, String contextId) {
        List<Artifact> inputs = new ArrayList<>(request.inputs().size());
        for (ArtifactKey key : request.inputs()) {
            Artifact input = registry.find(key).orElseThrow(
                    () -> new ValidationException("Input " + key + " of " + contextId + " is not registered"));
            if (!input.isPublished()) {
                throw new ValidationException("Input " + key + " of " + contextId + " is "
                                              + input.getLifecycleState() + ", not PUBLISHED");
            }
            inputs.add(input);
        }
        return inputs;
    }

    private StageOutput invoke(StageFunction function, StageRequest request, List<Artifact> inputs,
                               String contextId) {
        Duration timeout = pipelineConfig.getStages().timeoutFor(request.stage());
        Future<StageOutput> future = stageTaskExecutor.submit(() -> retryExecutor.execute(
                contextId, attempt -> {
                    log.debug("[{}] Attempt {} of {}.", contextId, attempt, retryExecutor.getMaxAttempts());
                    return function.execute(new StageInvocation(request, inputs, attempt));
                }));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[{}] Stage timed out after {}; cancelled.", contextId, timeout);
            throw new StageCancelledException("Stage " + contextId + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StageCancelledException("Interrupted while waiting for stage " + contextId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new PipelineException("Stage " + contextId + " failed: " + cause.getMessage(), cause);
        }
    }

    private Artifact publish(StageRequest request, List<Artifact> inputs, StageOutput produced, String contextId) {
        ArtifactKey output = request.output();
        String publishedPath = publisher.publish(output, produced.path());
        registry.updateContent(output, publishedPath, produced.metadata());

        for (StageOutput.AuxiliaryOutput auxiliary : produced.auxiliary()) {
            publishAuxiliary(output, auxiliary, contextId);
        }

        if (!registry.markPublished(output)) {
            throw new IllegalStateException("Output " + output + " left PUBLISHING while its lock was held");
        }
        String relation = request.stage().name().toLowerCase();
        for (Artifact input : inputs) {
            registry.link(input.key(), output, relation);
        }
        log.info("[{}] Published {} at '{}'.", contextId, output, publishedPath);
        return registry.get(output);
    }

    private void publishAuxiliary(ArtifactKey primary, StageOutput.AuxiliaryOutput auxiliary, String contextId) {
        ArtifactKey key = auxiliary.key();
        Artifact registered = registry.register(key, auxiliary.path(), auxiliary.metadata());
        String publishedPath = publisher.publish(key, auxiliary.path());
        if (registered.getLifecycleState() == LifecycleState.FAILED) {
            registry.resetForReplay(key);
        }
        registry.markPublishing(key);
        registry.updateContent(key, publishedPath, auxiliary.metadata());
        registry.markPublished(key);
        registry.link(primary, key, "produced");
        log.debug("[{}] Published auxiliary {} at '{}'.", contextId, key, publishedPath);
    }

    private Artifact recordFailure(StageRequest request, RuntimeException error, String contextId) {
        ArtifactKey output = request.output();
        String message = describe(error);
        int maxAttempts = pipelineConfig.getRegistry().getMaxAttempts();

        if (isCausedBy(error, ValidationException.class)) {
            registry.markFailedTerminal(output, message);
            deadLetter(request, DeadLetterReason.INVALID_DATA, error, 1);
        } else if (isCausedBy(error, TransientProcessingException.class)
                   || error instanceof CircuitBreakerOpenException) {
            Optional<LifecycleState> state = registry.markFailed(output, message, maxAttempts);
            if (state.isPresent() && state.get() == LifecycleState.FAILED) {
                DeadLetterReason reason = error instanceof CircuitBreakerOpenException
                        ? DeadLetterReason.CIRCUIT_OPEN : DeadLetterReason.RETRIES_EXHAUSTED;
                deadLetter(request, reason, error, registry.get(output).getPublishAttempts());
            }
        } else {
            log.error("[{}] Unexpected failure.", contextId, error);
            registry.markFailedTerminal(output, message);
            deadLetter(request, DeadLetterReason.NON_RETRYABLE_ERROR, error, 1);
        }
        return registry.get(output);
    }

    private void deadLetter(StageRequest request, DeadLetterReason reason, Throwable error, int attempts) {
        deadLetterQueue.add(COMPONENT, request.stage().name(), reason, error, request.toContext(), attempts);
    }

    private static boolean isCausedBy(Throwable error, Class<? extends Throwable> type) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static String describe(Throwable error) {
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    static String contextId(StageRequest request) {
        return request.groupId() + "/" + request.stage();
    }
}
