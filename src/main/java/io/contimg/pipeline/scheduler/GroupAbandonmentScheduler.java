package io.contimg.pipeline.scheduler;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.model.IncomingFile;
import io.contimg.pipeline.repository.IncomingFileRepository;
import io.contimg.pipeline.service.detect.GroupEmissionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Gives up on members that never became part of a complete group within their profile's maximum age.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GroupAbandonmentScheduler {

    private final PipelineConfig pipelineConfig;
    private final IncomingFileRepository incomingFileRepository;
    private final GroupEmissionService groupEmissionService;
    private final Clock clock;

    @Scheduled(cron = "${app.scheduler.group-abandonment:0 */5 * * * *}")
    public void abandonStaleMembers() {
        if (!pipelineConfig.getDetection().isEnabled()) {
            return;
        }
        PipelineConfig.Detection detection = pipelineConfig.getDetection();
        abandonStaleMembers(detection.getSubband());
        abandonStaleMembers(detection.getMosaic());
    }

    /**
     * @return the number of members abandoned
     */
    public int abandonStaleMembers(PipelineConfig.Profile profile) {
        LocalDateTime threshold = LocalDateTime.now(clock).minusMinutes(profile.getMaxAgeMinutes());
        List<IncomingFile> stale = incomingFileRepository.findByKindAndUpstreamStatusAndReceivedAtBefore(
                profile.getKind(), profile.getRequiredStatus(), threshold);
        if (CollectionUtils.isEmpty(stale)) {
            return 0;
        }
        log.warn("Found {} {} member(s) pending since before {}.", stale.size(), profile.getKind(), threshold);

        // One abandonment record per group key and observation time.
        Map<String, List<IncomingFile>> byObservation = stale.stream().collect(Collectors.groupingBy(
                f -> f.getGroupKey() + "|" + f.getObservedAt(), LinkedHashMap::new, Collectors.toList()));
        String remark = String.format("Incomplete after %d minute(s); expected %d member(s).",
                                      profile.getMaxAgeMinutes(), profile.getExpectedMembers());
        int abandoned = 0;
        for (List<IncomingFile> members : byObservation.values()) {
            groupEmissionService.abandon(profile.getKind(), members.get(0).getGroupKey(), members,
                                         profile.getRequiredStatus(), remark);
            abandoned += members.size();
        }
        return abandoned;
    }
}
