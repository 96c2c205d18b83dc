package io.contimg.pipeline.service.mosaic;

/**
 * A tile admitted to the combination with its normalised weight.
 */
public record WeightedTile(TileQualityMetrics tile, double weight) {
}
