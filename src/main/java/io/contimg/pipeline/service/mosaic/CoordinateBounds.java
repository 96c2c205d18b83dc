package io.contimg.pipeline.service.mosaic;

import java.util.Collection;

/**
 * Axis-aligned sky footprint in degrees. RA wrap-around is not handled; tiles are expected not to straddle 0h.
 */
public record CoordinateBounds(double raMin, double raMax, double decMin, double decMax) {

    public CoordinateBounds {
        if (raMin > raMax || decMin > decMax) {
            throw new IllegalArgumentException("Inverted bounds: " + raMin + ".." + raMax + ", " + decMin + ".." + decMax);
        }
    }

    /**
     * Closed-interval overlap test; footprints that only touch at an edge intersect.
     */
    public boolean intersects(CoordinateBounds other) {
        return raMin <= other.raMax && other.raMin <= raMax
                && decMin <= other.decMax && other.decMin <= decMax;
    }

    public CoordinateBounds expand(double marginDeg) {
        return new CoordinateBounds(raMin - marginDeg, raMax + marginDeg, decMin - marginDeg, decMax + marginDeg);
    }

    public double centerRa() {
        return (raMin + raMax) / 2.0;
    }

    public double centerDec() {
        return (decMin + decMax) / 2.0;
    }

    public static CoordinateBounds union(Collection<CoordinateBounds> bounds) {
        if (bounds.isEmpty()) {
            throw new IllegalArgumentException("Cannot take the union of no bounds");
        }
        double raMin = Double.POSITIVE_INFINITY;
        double raMax = Double.NEGATIVE_INFINITY;
        double decMin = Double.POSITIVE_INFINITY;
        double decMax = Double.NEGATIVE_INFINITY;
        for (CoordinateBounds b : bounds) {
            raMin = Math.min(raMin, b.raMin);
            raMax = Math.max(raMax, b.raMax);
            decMin = Math.min(decMin, b.decMin);
            decMax = Math.max(decMax, b.decMax);
        }
        return new CoordinateBounds(raMin, raMax, decMin, decMax);
    }
}
