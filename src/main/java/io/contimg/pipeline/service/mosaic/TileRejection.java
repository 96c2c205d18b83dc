package io.contimg.pipeline.service.mosaic;

public record TileRejection(String tileId, String reason) {
}
