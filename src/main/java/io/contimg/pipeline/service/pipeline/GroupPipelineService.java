package io.contimg.pipeline.service.pipeline;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.exception.LockTimeoutException;
import io.contimg.pipeline.exception.StageCancelledException;
import io.contimg.pipeline.exception.ValidationException;
import io.contimg.pipeline.model.Artifact;
import io.contimg.pipeline.model.ArtifactKey;
import io.contimg.pipeline.model.DataType;
import io.contimg.pipeline.model.FileKind;
import io.contimg.pipeline.model.LifecycleState;
import io.contimg.pipeline.model.ProcessingGroup;
import io.contimg.pipeline.service.detect.FileArrivalService;
import io.contimg.pipeline.service.detect.Group;
import io.contimg.pipeline.service.detect.GroupEmissionService;
import io.contimg.pipeline.service.registry.ArtifactRegistryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Drives emitted groups through their stages.
 * <p>
 * A subband group runs {@code CONVERT -> CALIBRATE -> IMAGE}; each stage starts only once its precursor is
 * published, and the published image is indexed for mosaic detection. A mosaic group runs {@code COMBINE} over
 * its images. Stage outputs that fall back to staging are run again until they settle.
 */
@Slf4j
@Service
public class GroupPipelineService {

    static final List<PipelineStage> SUBBAND_STAGES = List.of(PipelineStage.CONVERT, PipelineStage.CALIBRATE,
                                                              PipelineStage.IMAGE);

    private final PipelineStageRunner stageRunner;
    private final ArtifactRegistryService registry;
    private final FileArrivalService fileArrivalService;
    private final GroupEmissionService groupEmissionService;
    private final PipelineConfig pipelineConfig;
    private final AsyncTaskExecutor groupTaskExecutor;

    public GroupPipelineService(PipelineStageRunner stageRunner, ArtifactRegistryService registry,
                                FileArrivalService fileArrivalService, GroupEmissionService groupEmissionService,
                                PipelineConfig pipelineConfig,
                                @Qualifier("groupTaskExecutor") AsyncTaskExecutor groupTaskExecutor) {
        this.stageRunner = stageRunner;
        this.registry = registry;
        this.fileArrivalService = fileArrivalService;
        this.groupEmissionService = groupEmissionService;
        this.pipelineConfig = pipelineConfig;
        this.groupTaskExecutor = groupTaskExecutor;
    }

    /**
     * Hands a group to the group executor.
     *
     * @return completes with the group's final artifact, or with {@code null} if the group failed
     */
    public CompletableFuture<Artifact> submit(Group group) {
        log.info("[{}] Submitting {} group of {} member(s).", group.groupId(), group.kind(), group.members().size());
        return CompletableFuture.supplyAsync(() -> process(group), groupTaskExecutor);
    }

    /**
     * Picks an interrupted group back up. Stages that already published are skipped by the runner.
     */
    public Optional<CompletableFuture<Artifact>> resume(ProcessingGroup record) {
        Optional<Group> group = groupEmissionService.reconstruct(record);
        if (group.isEmpty()) {
            groupEmissionService.markFailed(record.getGroupId(), "Members could not be identified on resume");
            return Optional.empty();
        }
        log.info("[{}] Resuming interrupted group.", record.getGroupId());
        return Optional.of(submit(group.get()));
    }

    /**
     * Runs a group to the end on the calling thread. Failures are recorded on the group's emission record.
     */
    public Artifact process(Group group) {
        try {
            return group.kind() == FileKind.SUBBAND ? processSubbandGroup(group) : processMosaicGroup(group);
        } catch (LockTimeoutException e) {
            // Another worker still holds a stage output; the group stays EMITTED and is picked up on resume.
            log.warn("[{}] Group deferred: {}", group.groupId(), e.getMessage());
            groupEmissionService.markDeferred(group.groupId(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.error("[{}] Group processing failed: {}", group.groupId(), e.getMessage(), e);
            groupEmissionService.markFailed(group.groupId(), e.getClass().getSimpleName() + ": " + e.getMessage());
            return null;
        }
    }

    public Artifact processSubbandGroup(Group group) {
        List<ArtifactKey> rawUnits = new ArrayList<>(group.members().size());
        for (Group.Member member : group.members()) {
            rawUnits.add(registerRawUnit(group.groupId(), member));
        }
        return continueSubbandGroup(new StageRequest(PipelineStage.CONVERT, group.groupId(), rawUnits));
    }

    /**
     * Runs {@code request} and then every later subband stage, stopping at the first output that does not
     * publish.
     */
    public Artifact continueSubbandGroup(StageRequest request) {
        String groupId = request.groupId();
        Artifact last = null;
        StageRequest next = request;
        for (int i = SUBBAND_STAGES.indexOf(request.stage()); i < SUBBAND_STAGES.size(); i++) {
            if (next == null) {
                next = new StageRequest(SUBBAND_STAGES.get(i), groupId, List.of(last.key()));
            }
            last = runUntilSettled(next);
            if (!last.isPublished()) {
                groupEmissionService.markFailed(groupId, next.stage() + " output " + last.key() + " is "
                                                         + last.getLifecycleState());
                return last;
            }
            next = null;
        }
        indexImage(last);
        groupEmissionService.markCompleted(groupId);
        return last;
    }

    public Artifact processMosaicGroup(Group group) {
        List<ArtifactKey> images = new ArrayList<>(group.members().size());
        for (String path : group.memberPaths()) {
            Artifact image = registry.findByPath(DataType.IMAGE, path).orElseThrow(
                    () -> new ValidationException("Mosaic member '" + path + "' is not a registered image"));
            images.add(image.key());
        }
        return continueMosaicGroup(new StageRequest(PipelineStage.COMBINE, group.groupId(), images));
    }

    public Artifact continueMosaicGroup(StageRequest request) {
        Artifact mosaic = runUntilSettled(request);
        if (mosaic.isPublished()) {
            groupEmissionService.markCompleted(request.groupId());
        } else {
            groupEmissionService.markFailed(request.groupId(), "Mosaic " + mosaic.key() + " is "
                                                               + mosaic.getLifecycleState());
        }
        return mosaic;
    }

    /**
     * Runs the stage again while its output falls back to {@code STAGING}, up to the registry's attempt limit.
     * <p>
     * A run that cannot get the output's lock does not count as an attempt: the holder is working on the same
     * output and gives it up within the stage timeout, so contention is waited out for that long before the
     * {@link LockTimeoutException} is passed on.
     */
    public Artifact runUntilSettled(StageRequest request) {
        int maxAttempts = pipelineConfig.getRegistry().getMaxAttempts();
        Duration patience = pipelineConfig.getStages().timeoutFor(request.stage())
                .plus(pipelineConfig.getLock().getAcquireTimeout());
        long giveUpAt = System.nanoTime() + patience.toNanos();
        int run = 1;
        while (run <= maxAttempts) {
            try {
                Artifact artifact = stageRunner.runStage(request);
                if (artifact.getLifecycleState() != LifecycleState.STAGING) {
                    return artifact;
                }
                log.info("[{}/{}] Output back in STAGING after run {} of {}.", request.groupId(), request.stage(),
                         run, maxAttempts);
            } catch (StageCancelledException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                log.warn("[{}/{}] Run {} of {} cancelled: {}", request.groupId(), request.stage(), run, maxAttempts,
                         e.getMessage());
            } catch (LockTimeoutException e) {
                if (System.nanoTime() - giveUpAt >= 0) {
                    throw e;
                }
                log.info("[{}/{}] Output is locked by another worker; trying again.", request.groupId(),
                         request.stage());
                continue;
            }
            run++;
        }
        return registry.get(request.output());
    }

    private ArtifactKey registerRawUnit(String groupId, Group.Member member) {
        ArtifactKey key = new ArtifactKey(DataType.RAW_UNIT, member.path());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("group_id", groupId);
        if (member.memberIndex() != null) {
            metadata.put("subband_index", member.memberIndex());
        }
        if (member.observedAt() != null) {
            metadata.put(StageInvocation.OBSERVED_AT, DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(member.observedAt()));
        }
        Artifact raw = registry.register(key, member.path(), metadata);
        if (raw.getLifecycleState() == LifecycleState.STAGING && registry.markPublishing(key)) {
            registry.markPublished(key);
        }
        return key;
    }

    private void indexImage(Artifact image) {
        Object observedAt = image.getMetadata().get(StageInvocation.OBSERVED_AT);
        if (observedAt == null) {
            log.warn("[{}] Image has no observation time; not indexed for mosaicking.", image.key());
            return;
        }
        try {
            fileArrivalService.recordImage(image.getStagePath(), LocalDateTime.parse(observedAt.toString()));
        } catch (DateTimeParseException e) {
            log.warn("[{}] Unreadable observation time '{}'; not indexed for mosaicking.", image.key(), observedAt);
        }
    }
}
