package io.contimg.pipeline.service.detect;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.model.FileKind;
import io.contimg.pipeline.model.IncomingFile;
import io.contimg.pipeline.model.UpstreamStatus;
import io.contimg.pipeline.repository.IncomingFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.File;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Maintains the file arrival index that the group detector reads.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileArrivalService {

    private final IncomingFileRepository incomingFileRepository;
    private final ProcessingGroupAtomicService atomicService;
    private final PipelineConfig pipelineConfig;

    /**
     * Indexes a newly arrived subband file. The timestamp in its name is snapped onto an already-collecting
     * observation when one lies within the cluster tolerance, so that subbands written a few seconds apart share
     * one timestamp. Indexing the same path twice returns the existing entry.
     */
    public IncomingFile recordSubbandArrival(String path) {
        Optional<IncomingFile> existing = incomingFileRepository.findByPath(path);
        if (existing.isPresent()) {
            return existing.get();
        }
        PipelineConfig.Detection detection = pipelineConfig.getDetection();
        Optional<SubbandFileName> parsed = SubbandFileName.parse(path);
        if (parsed.isEmpty()) {
            log.warn("Subband file '{}' does not follow the naming pattern; indexing without a timestamp.", path);
        }
        LocalDateTime observedAt = parsed.map(p -> clusterTimestamp(p.timestamp(), detection)).orElse(null);

        IncomingFile entry = IncomingFile.builder()
                .path(path)
                .kind(FileKind.SUBBAND)
                .groupKey(detection.getStreamKey())
                .memberIndex(parsed.map(SubbandFileName::subbandIndex).orElse(null))
                .observedAt(observedAt)
                .upstreamStatus(UpstreamStatus.ARRIVED)
                .build();
        return index(entry);
    }

    /**
     * Indexes a published image for mosaic detection.
     */
    public IncomingFile recordImage(String path, LocalDateTime observedAt) {
        return incomingFileRepository.findByPath(path).orElseGet(() -> index(IncomingFile.builder()
                .path(path)
                .kind(FileKind.IMAGE)
                .groupKey(pipelineConfig.getDetection().getMosaicGroupKey())
                .observedAt(observedAt)
                .upstreamStatus(UpstreamStatus.IMAGED)
                .build()));
    }

    private IncomingFile index(IncomingFile entry) {
        try {
            IncomingFile saved = atomicService.attemptToIndex(entry);
            log.debug("Indexed {} '{}' at {}.", entry.getKind(), entry.getPath(), entry.getObservedAt());
            return saved;
        } catch (DataIntegrityViolationException e) {
            return incomingFileRepository.findByPath(entry.getPath())
                    .orElseThrow(() -> new IllegalStateException("Index entry for " + entry.getPath()
                                                                         + " collided but could not be re-read", e));
        }
    }

    private LocalDateTime clusterTimestamp(LocalDateTime timestamp, PipelineConfig.Detection detection) {
        Duration tolerance = detection.getClusterTolerance();
        List<IncomingFile> nearby = incomingFileRepository.findByKindAndUpstreamStatusAndObservedAtBetween(
                FileKind.SUBBAND, UpstreamStatus.ARRIVED, timestamp.minus(tolerance), timestamp.plus(tolerance));
        return nearby.stream()
                .map(IncomingFile::getObservedAt)
                .min(Comparator.comparing((LocalDateTime t) -> Duration.between(t, timestamp).abs())
                             .thenComparing(Comparator.naturalOrder()))
                .orElse(timestamp);
    }

    /**
     * Indexes every subband file already present in {@code directory}.
     *
     * @return how many files matched the naming pattern
     */
    public int bootstrap(File directory) {
        if (!directory.isDirectory()) {
            log.warn("Bootstrap directory '{}' does not exist; nothing indexed.", directory);
            return 0;
        }
        Collection<File> files = FileUtils.listFiles(directory, new String[]{"hdf5"}, false);
        List<File> subbands = files.stream()
                .filter(f -> SubbandFileName.matches(f.getName()))
                .sorted(Comparator.comparing(File::getName))
                .toList();
        subbands.forEach(f -> recordSubbandArrival(f.getAbsolutePath()));
        log.info("Bootstrap indexed {} subband file(s) from '{}'.", subbands.size(), directory);
        return subbands.size();
    }

    @Transactional
    public int updateStatus(Collection<String> paths, UpstreamStatus newStatus, UpstreamStatus expectedStatus) {
        return incomingFileRepository.updateStatusIfExpected(paths, newStatus, expectedStatus);
    }
}
