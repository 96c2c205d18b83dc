package io.contimg.pipeline.service.pipeline;

import io.contimg.pipeline.exception.DeadLetterReplayException;
import io.contimg.pipeline.model.ArtifactKey;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What to run: one stage of one group over a fixed list of input artifacts. The output artifact is named after
 * the group, so running the same request twice always targets the same output.
 */
public record StageRequest(PipelineStage stage, String groupId, List<ArtifactKey> inputs) {

    static final String STAGE_KEY = "stage";
    static final String GROUP_KEY = "groupId";
    static final String INPUTS_KEY = "inputs";
    static final String OUTPUT_KEY = "output";

    public StageRequest {
        inputs = List.copyOf(inputs);
    }

    public ArtifactKey output() {
        return new ArtifactKey(stage.getOutputType(), groupId);
    }

    /**
     * Everything a dead-letter replay needs to rebuild this request.
     */
    public Map<String, Object> toContext() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(STAGE_KEY, stage.name());
        context.put(GROUP_KEY, groupId);
        context.put(INPUTS_KEY, inputs.stream().map(ArtifactKey::toString).toList());
        context.put(OUTPUT_KEY, output().toString());
        return context;
    }

    public static StageRequest fromContext(Map<String, Object> context) {
        Object stage = context.get(STAGE_KEY);
        Object groupId = context.get(GROUP_KEY);
        Object inputs = context.get(INPUTS_KEY);
        if (stage == null || groupId == null || !(inputs instanceof List<?> inputList)) {
            throw new DeadLetterReplayException("Dead-letter context does not describe a stage invocation: " + context);
        }
        try {
            return new StageRequest(PipelineStage.valueOf(stage.toString()), groupId.toString(),
                                    inputList.stream().map(i -> ArtifactKey.parse(i.toString())).toList());
        } catch (IllegalArgumentException e) {
            throw new DeadLetterReplayException("Dead-letter context is malformed: " + e.getMessage());
        }
    }
}
