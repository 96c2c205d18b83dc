package io.contimg.pipeline.service.detect;

import io.contimg.pipeline.model.FileKind;
import io.contimg.pipeline.model.IncomingFile;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A complete set of index entries that together form one unit of work. Members are ordered by timestamp,
 * then member index, then path.
 */
public record Group(String groupId, FileKind kind, String groupKey, List<Member> members,
                    LocalDateTime windowStart, LocalDateTime windowEnd, boolean complete) {

    public Group {
        members = List.copyOf(members);
    }

    public List<String> memberPaths() {
        return members.stream().map(Member::path).toList();
    }

    public LocalDateTime earliest() {
        return members.get(0).observedAt();
    }

    public static String groupIdFor(String groupKey, LocalDateTime earliest) {
        return groupKey + "_" + SubbandFileName.TIMESTAMP_FORMAT.format(earliest);
    }

    public record Member(String path, Integer memberIndex, LocalDateTime observedAt) {

        static Member of(IncomingFile file) {
            return new Member(file.getPath(), file.getMemberIndex(), file.getObservedAt());
        }
    }
}
