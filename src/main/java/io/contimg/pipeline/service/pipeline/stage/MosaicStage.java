package io.contimg.pipeline.service.pipeline.stage;

import io.contimg.pipeline.exception.ValidationException;
import io.contimg.pipeline.service.mosaic.CombineOutcome;
import io.contimg.pipeline.service.mosaic.CoordinateBounds;
import io.contimg.pipeline.service.mosaic.TileCombiner;
import io.contimg.pipeline.service.mosaic.TileQualityMetrics;
import io.contimg.pipeline.service.pipeline.PipelineStage;
import io.contimg.pipeline.service.pipeline.StageFunction;
import io.contimg.pipeline.service.pipeline.StageInvocation;
import io.contimg.pipeline.service.pipeline.StageOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Combines the images of a mosaic group into one mosaic.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MosaicStage implements StageFunction {

    private final TileCombiner tileCombiner;

    @Override
    public PipelineStage stage() {
        return PipelineStage.COMBINE;
    }

    @Override
    public StageOutput execute(StageInvocation invocation) {
        List<TileQualityMetrics> tiles = invocation.inputs().stream().map(TileQualityMetrics::fromArtifact).toList();
        CoordinateBounds template = template(tiles);
        log.info("[{}] Mosaic template RA {}..{}, Dec {}..{} from {} tile(s).", invocation.groupId(),
                 template.raMin(), template.raMax(), template.decMin(), template.decMax(), tiles.size());

        CombineOutcome outcome = tileCombiner.combine(invocation.groupId(), tiles, template);
        if (!outcome.validation().passed()) {
            log.warn("[{}] Mosaic published with QA warnings: {}", invocation.groupId(),
                     outcome.validation().issues());
        }
        return new StageOutput(outcome.outputPath(), invocation.withProvenance(outcome.toMetadata()));
    }

    /**
     * The strip a drift-scan mosaic covers: the RA extent of all tiles at the declination band of the median
     * tile. Tiles at other declinations then fail the overlap test.
     */
    static CoordinateBounds template(List<TileQualityMetrics> tiles) {
        List<CoordinateBounds> bounds = tiles.stream().map(TileQualityMetrics::bounds).filter(Objects::nonNull)
                .sorted(Comparator.comparingDouble(CoordinateBounds::centerDec))
                .toList();
        if (bounds.isEmpty()) {
            throw new ValidationException("None of the " + tiles.size() + " tile(s) recorded a sky footprint");
        }
        CoordinateBounds median = bounds.get(bounds.size() / 2);
        CoordinateBounds raExtent = CoordinateBounds.union(bounds);
        return new CoordinateBounds(raExtent.raMin(), raExtent.raMax(), median.decMin(), median.decMax());
    }
}
