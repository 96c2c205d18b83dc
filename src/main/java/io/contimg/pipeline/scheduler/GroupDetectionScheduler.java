package io.contimg.pipeline.scheduler;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.model.IncomingFile;
import io.contimg.pipeline.model.ProcessingGroup;
import io.contimg.pipeline.repository.IncomingFileRepository;
import io.contimg.pipeline.service.detect.FileArrivalService;
import io.contimg.pipeline.service.detect.Group;
import io.contimg.pipeline.service.detect.GroupDetector;
import io.contimg.pipeline.service.detect.GroupEmissionService;
import io.contimg.pipeline.service.pipeline.GroupPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.io.File;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The monitor loop. Indexes new subband files, looks for complete groups around every pending member, emits each
 * group once and hands it to the pipeline.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GroupDetectionScheduler {

    private final PipelineConfig pipelineConfig;
    private final IncomingFileRepository incomingFileRepository;
    private final FileArrivalService fileArrivalService;
    private final GroupDetector groupDetector;
    private final GroupEmissionService groupEmissionService;
    private final GroupPipelineService groupPipelineService;

    /**
     * Indexes what arrived while the service was down and resumes groups whose processing was interrupted.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!pipelineConfig.getDetection().isEnabled()) {
            log.info("Group detection disabled; skipping startup bootstrap and resume.");
            return;
        }
        scanInputDirectory();
        List<ProcessingGroup> interrupted = groupEmissionService.findInterrupted();
        if (!interrupted.isEmpty()) {
            log.warn("Found {} group(s) interrupted by a previous shutdown; resuming.", interrupted.size());
            interrupted.forEach(groupPipelineService::resume);
        }
    }

    @Scheduled(fixedDelayString = "${app.scheduler.input-scan-delay-ms:30000}",
            initialDelayString = "${app.scheduler.input-scan-delay-ms:30000}")
    public void scanInputDirectory() {
        String inputDirectory = pipelineConfig.getDetection().getInputDirectory();
        if (!pipelineConfig.getDetection().isEnabled() || !StringUtils.hasText(inputDirectory)) {
            return;
        }
        fileArrivalService.bootstrap(new File(inputDirectory));
    }

    @Scheduled(fixedDelayString = "${app.scheduler.group-detection-delay-ms:10000}")
    public void detectGroups() {
        if (!pipelineConfig.getDetection().isEnabled()) {
            return;
        }
        PipelineConfig.Detection detection = pipelineConfig.getDetection();
        int emitted = detectGroups(detection.getSubband()) + detectGroups(detection.getMosaic());
        if (emitted > 0) {
            log.info("Group detection cycle emitted {} group(s).", emitted);
        }
    }

    /**
     * One detection pass over the pending members of a profile.
     *
     * @return the number of groups emitted
     */
    public int detectGroups(PipelineConfig.Profile profile) {
        List<IncomingFile> pending = incomingFileRepository.findTop500ByKindAndUpstreamStatusOrderByObservedAtAsc(
                profile.getKind(), profile.getRequiredStatus());
        if (CollectionUtils.isEmpty(pending)) {
            return 0;
        }
        log.debug("{} pending {} member(s) to examine.", pending.size(), profile.getKind());

        Set<String> settled = new HashSet<>();
        int emitted = 0;
        for (IncomingFile reference : pending) {
            if (reference.getObservedAt() == null || settled.contains(reference.getPath())) {
                continue;
            }
            Optional<Group> group = groupDetector.detect(reference, profile.getWindowMinutes(),
                                                         profile.getRequiredStatus(), profile.getExpectedMembers());
            if (group.isEmpty()) {
                continue;
            }
            settled.addAll(group.get().memberPaths());
            if (groupEmissionService.emit(group.get(), profile.getRequiredStatus()).isPresent()) {
                groupPipelineService.submit(group.get());
                emitted++;
            }
        }
        return emitted;
    }
}
