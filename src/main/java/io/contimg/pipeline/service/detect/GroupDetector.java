package io.contimg.pipeline.service.detect;

import io.contimg.pipeline.model.IncomingFile;
import io.contimg.pipeline.model.UpstreamStatus;
import io.contimg.pipeline.repository.IncomingFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether the members around a reference entry form a complete group.
 * <p>
 * Candidates are the entries of the reference's kind and group key within half a window either side of the
 * reference time, in the required upstream status, with a known timestamp, de-duplicated by path. Exactly the
 * expected number of candidates is a group. Fewer is not. When there are more, the contiguous run of expected
 * size with the smallest time span wins, and among equal spans the run centred closest to the reference.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupDetector {

    static final Comparator<IncomingFile> MEMBER_ORDER = Comparator
            .comparing(IncomingFile::getObservedAt)
            .thenComparing(IncomingFile::getMemberIndex, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(IncomingFile::getPath);

    private final IncomingFileRepository incomingFileRepository;

    @Transactional(readOnly = true)
    public Optional<Group> detect(IncomingFile reference, long windowMinutes, UpstreamStatus requiredStatus,
                                  int expectedMembers) {
        if (reference == null || reference.getObservedAt() == null || expectedMembers <= 0) {
            return Optional.empty();
        }
        LocalDateTime t = reference.getObservedAt();
        Duration half = Duration.ofMinutes(windowMinutes).dividedBy(2);
        LocalDateTime start = t.minus(half);
        LocalDateTime end = t.plus(half);

        Map<String, IncomingFile> byPath = new LinkedHashMap<>();
        for (IncomingFile file : incomingFileRepository.findInWindow(reference.getKind(), reference.getGroupKey(),
                                                                      start, end)) {
            if (file.getObservedAt() != null && file.getUpstreamStatus() == requiredStatus) {
                byPath.putIfAbsent(file.getPath(), file);
            }
        }
        List<IncomingFile> candidates = new ArrayList<>(byPath.values());
        candidates.sort(MEMBER_ORDER);

        if (candidates.size() < expectedMembers) {
            log.debug("[{}] {} of {} member(s) present around {}.", reference.getGroupKey(), candidates.size(),
                      expectedMembers, t);
            return Optional.empty();
        }
        List<IncomingFile> chosen = candidates.size() == expectedMembers
                ? candidates
                : tightestRun(candidates, expectedMembers, t);

        List<Group.Member> members = chosen.stream().map(Group.Member::of).toList();
        LocalDateTime earliest = members.get(0).observedAt();
        Group group = new Group(Group.groupIdFor(reference.getGroupKey(), earliest), reference.getKind(),
                                reference.getGroupKey(), members, start, end, true);
        log.debug("[{}] Complete group of {} member(s) from {} candidate(s).", group.groupId(), members.size(),
                  candidates.size());
        return Optional.of(group);
    }

    /**
     * Picks the contiguous run of {@code size} sorted candidates with the smallest span; ties go to the run
     * whose centre is nearest the reference time, then to the earliest run.
     */
    static List<IncomingFile> tightestRun(List<IncomingFile> sorted, int size, LocalDateTime reference) {
        int bestStart = 0;
        Duration bestSpan = null;
        Duration bestDistance = null;
        for (int i = 0; i + size <= sorted.size(); i++) {
            LocalDateTime first = sorted.get(i).getObservedAt();
            LocalDateTime last = sorted.get(i + size - 1).getObservedAt();
            Duration span = Duration.between(first, last);
            LocalDateTime centre = first.plus(span.dividedBy(2));
            Duration distance = Duration.between(centre, reference).abs();
            int bySpan = bestSpan == null ? -1 : span.compareTo(bestSpan);
            if (bySpan < 0 || (bySpan == 0 && distance.compareTo(bestDistance) < 0)) {
                bestStart = i;
                bestSpan = span;
                bestDistance = distance;
            }
        }
        return sorted.subList(bestStart, bestStart + size);
    }
}
