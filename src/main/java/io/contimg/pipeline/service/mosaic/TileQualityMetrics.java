package io.contimg.pipeline.service.mosaic;

import io.contimg.pipeline.model.Artifact;

import java.util.Map;
import java.util.Optional;

/**
 * Quality figures of one candidate tile, read from the image artifact's metadata.
 *
 * @param bounds the tile footprint, or null when the imaging stage did not record one
 */
public record TileQualityMetrics(String tileId, String path, CoordinateBounds bounds, double rmsNoise,
                                 double peakFlux, double dynamicRange, double pbCoverageFraction) {

    public static TileQualityMetrics fromArtifact(Artifact image) {
        Map<String, Object> metadata = image.getMetadata();
        CoordinateBounds bounds = readDouble(metadata, "ra_min")
                .flatMap(raMin -> readDouble(metadata, "ra_max")
                        .flatMap(raMax -> readDouble(metadata, "dec_min")
                                .flatMap(decMin -> readDouble(metadata, "dec_max")
                                        .map(decMax -> new CoordinateBounds(raMin, raMax, decMin, decMax)))))
                .orElse(null);
        double rms = readDouble(metadata, "rms_noise").orElse(Double.NaN);
        double peak = readDouble(metadata, "peak_flux").orElse(Double.NaN);
        double dynamicRange = readDouble(metadata, "dynamic_range")
                .orElse(rms > 0 ? peak / rms : Double.NaN);
        double coverage = readDouble(metadata, "pb_coverage").orElse(0.0);
        return new TileQualityMetrics(image.getDataId(), image.getStagePath(), bounds, rms, peak, dynamicRange,
                                      coverage);
    }

    private static Optional<Double> readDouble(Map<String, Object> metadata, String key) {
        Object value = metadata.get(key);
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Double.parseDouble(text));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
