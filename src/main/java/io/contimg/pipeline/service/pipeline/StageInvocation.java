package io.contimg.pipeline.service.pipeline;

import io.contimg.pipeline.model.Artifact;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One attempt at a stage, handed to the {@link StageFunction}.
 *
 * @param inputs  the published input artifacts, in request order
 * @param attempt 1-based attempt number within the current retry sequence
 */
public record StageInvocation(StageRequest request, List<Artifact> inputs, int attempt) {

    /**
     * ISO-8601 observation time, carried from the raw units through every derived artifact.
     */
    public static final String OBSERVED_AT = "observed_at";

    public String groupId() {
        return request.groupId();
    }

    public List<String> inputPaths() {
        return inputs.stream().map(Artifact::getStagePath).toList();
    }

    /**
     * Adds the group, the input keys and the earliest input observation time to stage-reported metadata.
     */
    public Map<String, Object> withProvenance(Map<String, Object> metadata) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put("group_id", groupId());
        merged.put("inputs", inputs.stream().map(a -> a.key().toString()).toList());
        inputs.stream()
                .map(a -> a.getMetadata().get(OBSERVED_AT))
                .filter(Objects::nonNull)
                .map(Object::toString)
                .min(Comparator.naturalOrder())
                .ifPresent(observedAt -> merged.put(OBSERVED_AT, observedAt));
        return merged;
    }
}
