package io.contimg.pipeline.service.mosaic;

import io.contimg.pipeline.config.PipelineConfig;
import io.contimg.pipeline.exception.ValidationException;
import io.contimg.pipeline.service.engine.EngineGateway;
import io.contimg.pipeline.service.engine.EngineResult;
import io.contimg.pipeline.service.engine.ImagePlane;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines overlapping image tiles into one mosaic.
 * <p>
 * Tiles are admitted in two passes. The overlap pass drops every tile whose footprint misses the template
 * (expanded by the pixel margin), whatever its quality. The quality pass then drops noisy, poorly covered or
 * low dynamic-range tiles among those left, judging noise against the median of the overlapping set. Survivors
 * are weighted by coverage over variance and combined by the engine; the result is validated and any issues
 * are reported alongside it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TileCombiner {

    static final String COMBINE_OPERATION = "combine";

    private final EngineGateway engineGateway;
    private final MosaicValidator mosaicValidator;
    private final PipelineConfig pipelineConfig;

    public CombineOutcome combine(String contextId, List<TileQualityMetrics> candidates, CoordinateBounds template) {
        PipelineConfig.Mosaic config = pipelineConfig.getMosaic();
        TileSelection selection = select(candidates, template, config);
        selection.rejected().forEach(r -> log.info("[{}] Tile '{}' rejected: {}", contextId, r.tileId(), r.reason()));

        if (selection.accepted().size() < config.getMinTiles()) {
            throw new ValidationException(String.format("Only %d of %d tile(s) usable for mosaic %s; need at least %d",
                                                        selection.accepted().size(), candidates.size(), contextId,
                                                        config.getMinTiles()));
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("weights", selection.accepted().stream().map(WeightedTile::weight).toList());
        parameters.put("template", Map.of("raMin", template.raMin(), "raMax", template.raMax(),
                                          "decMin", template.decMin(), "decMax", template.decMax()));
        List<String> inputs = selection.accepted().stream().map(t -> t.tile().path()).toList();

        log.info("[{}] Combining {} tile(s) ({} rejected).", contextId, inputs.size(), selection.rejected().size());
        EngineResult.Success result = engineGateway.invoke(contextId, COMBINE_OPERATION, inputs, parameters);

        ImagePlane plane = engineGateway.readImagePlane(contextId, result.outputPath());
        MosaicValidationReport report = mosaicValidator.validate(plane, config.getValidation());
        return new CombineOutcome(result.outputPath(), result.metrics(), selection.accepted(), selection.rejected(),
                                  report);
    }

    /**
     * Applies the overlap and quality filters and computes normalised weights. Does not touch the engine.
     */
    public TileSelection select(List<TileQualityMetrics> candidates, CoordinateBounds template,
                                PipelineConfig.Mosaic config) {
        List<TileRejection> rejected = new ArrayList<>();
        CoordinateBounds admission = template.expand(config.getOverlapMarginPixels() * config.getPixelScaleDeg());

        List<TileQualityMetrics> overlapping = new ArrayList<>();
        for (TileQualityMetrics tile : candidates) {
            if (tile.bounds() == null) {
                rejected.add(new TileRejection(tile.tileId(), "no coordinate bounds recorded"));
            } else if (!admission.intersects(tile.bounds())) {
                rejected.add(new TileRejection(tile.tileId(), "does not overlap the template"));
            } else {
                overlapping.add(tile);
            }
        }

        double medianRms = medianRms(overlapping);
        List<TileQualityMetrics> survivors = new ArrayList<>();
        for (TileQualityMetrics tile : overlapping) {
            String reason = qualityProblem(tile, medianRms, config);
            if (reason != null) {
                rejected.add(new TileRejection(tile.tileId(), reason));
            } else {
                survivors.add(tile);
            }
        }

        double totalWeight = survivors.stream().mapToDouble(TileCombiner::rawWeight).sum();
        List<WeightedTile> accepted = survivors.stream()
                .map(t -> new WeightedTile(t, rawWeight(t) / totalWeight))
                .toList();
        return new TileSelection(accepted, rejected);
    }

    private static String qualityProblem(TileQualityMetrics tile, double medianRms, PipelineConfig.Mosaic config) {
        double rms = tile.rmsNoise();
        if (!(rms > 0)) {
            return "no usable RMS noise";
        }
        if (rms > config.getMaxRmsNoise()) {
            return String.format("RMS %.4g above ceiling %.4g", rms, config.getMaxRmsNoise());
        }
        if (medianRms > 0 && rms > config.getMaxNoiseFactor() * medianRms) {
            return String.format("RMS %.4g above %.1f x median %.4g", rms, config.getMaxNoiseFactor(), medianRms);
        }
        if (tile.pbCoverageFraction() < config.getMinCoverageFraction()) {
            return String.format("coverage %.2f below floor %.2f", tile.pbCoverageFraction(),
                                 config.getMinCoverageFraction());
        }
        if (!(tile.dynamicRange() >= config.getMinDynamicRange())) {
            return String.format("dynamic range %.1f below minimum %.1f", tile.dynamicRange(),
                                 config.getMinDynamicRange());
        }
        return null;
    }

    private static double rawWeight(TileQualityMetrics tile) {
        return tile.pbCoverageFraction() / (tile.rmsNoise() * tile.rmsNoise());
    }

    private static double medianRms(List<TileQualityMetrics> tiles) {
        double[] values = tiles.stream().mapToDouble(TileQualityMetrics::rmsNoise).filter(v -> v > 0).sorted()
                .toArray();
        return values.length == 0 ? Double.NaN : MosaicValidator.median(values);
    }

    public record TileSelection(List<WeightedTile> accepted, List<TileRejection> rejected) {
    }
}
