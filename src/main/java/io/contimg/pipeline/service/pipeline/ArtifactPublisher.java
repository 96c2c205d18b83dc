package io.contimg.pipeline.service.pipeline;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.exception.TransientProcessingException;
import io.contimg.pipeline.exception.ValidationException;
import io.contimg.pipeline.model.ArtifactKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.File;
import java.io.IOException;

/**
 * Moves a stage product from where the stage wrote it into the published area, when one is configured.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArtifactPublisher {

    private final PipelineConfig pipelineConfig;

    /**
     * @return the path the artifact lives at after publishing
     */
    public String publish(ArtifactKey key, String stagedPath) {
        String publishedRoot = pipelineConfig.getRegistry().getPublishedRoot();
        if (!StringUtils.hasText(publishedRoot)) {
            return stagedPath;
        }
        File source = new File(stagedPath);
        File targetDirectory = new File(publishedRoot, key.dataType().name().toLowerCase());
        File target = new File(targetDirectory, FilenameUtils.getName(stagedPath));
        if (!source.exists()) {
            if (target.exists()) {
                log.info("[{}] '{}' already in the published area.", key, target);
                return target.getAbsolutePath();
            }
            throw new ValidationException("Staged product " + stagedPath + " of " + key + " does not exist");
        }
        if (source.getAbsoluteFile().equals(target.getAbsoluteFile())) {
            return target.getAbsolutePath();
        }
        try {
            FileUtils.moveToDirectory(source, targetDirectory, true);
        } catch (IOException e) {
            throw new TransientProcessingException("Could not move " + stagedPath + " to " + targetDirectory, e);
        }
        log.info("[{}] Moved '{}' to '{}'.", key, stagedPath, target);
        return target.getAbsolutePath();
    }
}
