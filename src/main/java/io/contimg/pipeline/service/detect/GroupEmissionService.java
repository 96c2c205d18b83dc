package io.contimg.pipeline.service.detect;

import io.contimg.pipeline.model.FileKind;
import io.contimg.pipeline.model.GroupStatus;
import io.contimg.pipeline.model.IncomingFile;
import io.contimg.pipeline.model.ProcessingGroup;
import io.contimg.pipeline.model.UpstreamStatus;
import io.contimg.pipeline.repository.IncomingFileRepository;
import io.contimg.pipeline.repository.ProcessingGroupRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Turns detected groups into durable emission records. A group id can be emitted only once; the unique key on
 * {@code processing_group.group_id} settles races between monitors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupEmissionService {

    private final ProcessingGroupRepository processingGroupRepository;
    private final IncomingFileRepository incomingFileRepository;
    private final ProcessingGroupAtomicService atomicService;

    /**
     * Records the group and moves its members to {@code GROUPED}.
     *
     * @return the new emission record, or empty if this group id was emitted before
     */
    @Transactional
    public Optional<ProcessingGroup> emit(Group group, UpstreamStatus memberStatus) {
        ProcessingGroup record = ProcessingGroup.builder()
                .groupId(group.groupId())
                .kind(group.kind())
                .groupKey(group.groupKey())
                .status(GroupStatus.EMITTED)
                .windowStart(group.windowStart())
                .windowEnd(group.windowEnd())
                .memberCount(group.members().size())
                .memberDigest(memberDigest(group.memberPaths()))
                .build();
        Optional<ProcessingGroup> created;
        try {
            created = Optional.of(atomicService.attemptToCreate(record));
            log.info("[{}] Emitted {} group with {} member(s).", group.groupId(), group.kind(), group.members().size());
        } catch (DataIntegrityViolationException e) {
            log.debug("[{}] Group already emitted; not emitting again.", group.groupId());
            created = Optional.empty();
        }
        // Also on a repeat, so members of a group whose emitter died before this point do not linger.
        int updated = incomingFileRepository.updateStatusIfExpected(group.memberPaths(), UpstreamStatus.GROUPED,
                                                                    memberStatus);
        log.debug("[{}] {} member(s) moved to GROUPED.", group.groupId(), updated);
        return created;
    }

    /**
     * Marks stale members as {@code ABANDONED} and records the abandonment once per group key and timestamp.
     */
    @Transactional
    public Optional<ProcessingGroup> abandon(FileKind kind, String groupKey, List<IncomingFile> members,
                                             UpstreamStatus memberStatus, String remark) {
        if (members.isEmpty()) {
            return Optional.empty();
        }
        List<IncomingFile> ordered = members.stream().sorted(Comparator.comparing(IncomingFile::getPath)).toList();
        List<String> paths = ordered.stream().map(IncomingFile::getPath).toList();
        int updated = incomingFileRepository.updateStatusIfExpected(paths, UpstreamStatus.ABANDONED, memberStatus);
        if (updated == 0) {
            return Optional.empty();
        }
        IncomingFile earliest = ordered.stream()
                .filter(f -> f.getObservedAt() != null)
                .min(Comparator.comparing(IncomingFile::getObservedAt))
                .orElse(ordered.get(0));
        String groupId = earliest.getObservedAt() == null
                ? groupKey + "_abandoned_" + DigestUtils.sha256Hex(String.join("\n", paths)).substring(0, 12)
                : Group.groupIdFor(groupKey, earliest.getObservedAt());
        ProcessingGroup record = ProcessingGroup.builder()
                .groupId(groupId)
                .kind(kind)
                .groupKey(groupKey)
                .status(GroupStatus.ABANDONED)
                .windowStart(earliest.getObservedAt())
                .memberCount(updated)
                .memberDigest(memberDigest(paths))
                .remark(remark)
                .build();
        try {
            ProcessingGroup saved = atomicService.attemptToCreate(record);
            log.warn("[{}] Abandoned {} incomplete member(s): {}", groupId, updated, remark);
            return Optional.of(saved);
        } catch (DataIntegrityViolationException e) {
            log.debug("[{}] Abandonment already recorded.", groupId);
            return Optional.empty();
        }
    }

    @Transactional
    public void markCompleted(String groupId) {
        updateStatus(groupId, GroupStatus.COMPLETED, null);
    }

    @Transactional
    public void markFailed(String groupId, String remark) {
        updateStatus(groupId, GroupStatus.FAILED, remark);
    }

    /**
     * Leaves the group {@code EMITTED}, so it is resumed later, and notes why it is waiting.
     */
    @Transactional
    public void markDeferred(String groupId, String remark) {
        updateStatus(groupId, GroupStatus.EMITTED, remark);
    }

    private void updateStatus(String groupId, GroupStatus status, String remark) {
        processingGroupRepository.findByGroupId(groupId).ifPresentOrElse(group -> {
            group.setStatus(status);
            group.setRemark(remark);
            processingGroupRepository.save(group);
            log.info("[{}] Group {}.", groupId, status);
        }, () -> log.warn("[{}] Cannot mark group {}; no emission record.", groupId, status));
    }

    @Transactional(readOnly = true)
    public List<ProcessingGroup> list(GroupStatus status, FileKind kind, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        if (status != null && kind != null) {
            return processingGroupRepository.findByStatusAndKindOrderByCreatedAtDesc(status, kind, page);
        }
        if (status != null) {
            return processingGroupRepository.findByStatusOrderByCreatedAtDesc(status, page);
        }
        if (kind != null) {
            return processingGroupRepository.findByKindOrderByCreatedAtDesc(kind, page);
        }
        return processingGroupRepository.findAllByOrderByCreatedAtDesc(page);
    }

    @Transactional(readOnly = true)
    public List<ProcessingGroup> findInterrupted() {
        return processingGroupRepository.findByStatusOrderByCreatedAtDesc(GroupStatus.EMITTED, PageRequest.of(0, 500));
    }

    @Transactional(readOnly = true)
    public Optional<ProcessingGroup> find(String groupId) {
        return processingGroupRepository.findByGroupId(groupId);
    }

    /**
     * Rebuilds the members of an emitted group from the index. The members are the contiguous run of grouped
     * entries inside the emission window whose path digest matches the one recorded at emission.
     *
     * @return the group, or empty if its members can no longer be identified
     */
    @Transactional(readOnly = true)
    public Optional<Group> reconstruct(ProcessingGroup record) {
        if (record.getWindowStart() == null || record.getWindowEnd() == null || record.getMemberCount() <= 0) {
            return Optional.empty();
        }
        List<IncomingFile> grouped = incomingFileRepository
                .findByKindAndUpstreamStatusAndObservedAtBetween(record.getKind(), UpstreamStatus.GROUPED,
                                                                 record.getWindowStart(), record.getWindowEnd())
                .stream()
                .filter(f -> record.getGroupKey().equals(f.getGroupKey()))
                .sorted(GroupDetector.MEMBER_ORDER)
                .toList();
        int size = record.getMemberCount();
        for (int i = 0; i + size <= grouped.size(); i++) {
            List<IncomingFile> run = grouped.subList(i, i + size);
            if (memberDigest(run.stream().map(IncomingFile::getPath).toList()).equals(record.getMemberDigest())) {
                return Optional.of(new Group(record.getGroupId(), record.getKind(), record.getGroupKey(),
                                             run.stream().map(Group.Member::of).toList(), record.getWindowStart(),
                                             record.getWindowEnd(), true));
            }
        }
        log.warn("[{}] Could not identify the {} member(s) of the interrupted group.", record.getGroupId(), size);
        return Optional.empty();
    }

    static String memberDigest(List<String> paths) {
        return DigestUtils.sha256Hex(String.join("\n", paths));
    }
}
