package io.contimg.pipeline.service.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Image statistics reported by the engine. Any value may be absent when the operation does not produce an image.
 *
 * @param peakFlux        brightest pixel, Jy/beam
 * @param rmsNoise        off-source noise estimate, Jy/beam
 * @param minFlux         most negative pixel, Jy/beam
 * @param flaggedFraction fraction of visibilities flagged by the operation
 * @param coverage        primary-beam coverage fraction of the image
 * @param extras          anything else the engine reported, e.g. coordinate bounds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QualityMetrics(Double peakFlux, Double rmsNoise, Double minFlux, Double flaggedFraction,
                             Double coverage, Map<String, Object> extras) {

    public static final QualityMetrics EMPTY = new QualityMetrics(null, null, null, null, null, Map.of());

    public QualityMetrics {
        extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    /**
     * Peak over RMS, or NaN when either is missing or the RMS is not positive.
     */
    public double snr() {
        if (peakFlux == null || rmsNoise == null || rmsNoise <= 0) {
            return Double.NaN;
        }
        return peakFlux / rmsNoise;
    }

    /**
     * Peak over the magnitude of the most negative pixel, falling back to {@link #snr()} when no minimum was
     * reported.
     */
    public double dynamicRange() {
        if (peakFlux == null) {
            return Double.NaN;
        }
        if (minFlux == null || minFlux == 0) {
            return snr();
        }
        return peakFlux / Math.abs(minFlux);
    }

    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>(extras);
        putIfPresent(metadata, "peak_flux", peakFlux);
        putIfPresent(metadata, "rms_noise", rmsNoise);
        putIfPresent(metadata, "min_flux", minFlux);
        putIfPresent(metadata, "flagged_fraction", flaggedFraction);
        putIfPresent(metadata, "pb_coverage", coverage);
        if (!Double.isNaN(snr())) {
            metadata.put("snr", snr());
            metadata.put("dynamic_range", dynamicRange());
        }
        return metadata;
    }

    private static void putIfPresent(Map<String, Object> target, String key, Double value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
