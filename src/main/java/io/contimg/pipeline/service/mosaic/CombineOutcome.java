package io.contimg.pipeline.service.mosaic;

import io.contimg.pipeline.service.engine.QualityMetrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record CombineOutcome(String outputPath, QualityMetrics metrics, List<WeightedTile> usedTiles,
                             List<TileRejection> rejectedTiles, MosaicValidationReport validation) {

    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>(metrics.toMetadata());
        metadata.put("tiles_used", usedTiles.stream().map(t -> t.tile().tileId()).toList());
        metadata.put("tiles_rejected", rejectedTiles.stream()
                .map(r -> Map.of("tile", r.tileId(), "reason", r.reason()))
                .toList());
        metadata.putAll(validation.toMetadata());
        return metadata;
    }
}
