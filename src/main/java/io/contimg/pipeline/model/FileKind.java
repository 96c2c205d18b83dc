package io.contimg.pipeline.model;

/**
 * Which index stream a file arrival belongs to.
 */
public enum FileKind {
    /**
     * A raw subband file from the correlator; groups of these become one converted unit.
     */
    SUBBAND,
    /**
     * A published image; groups of these become one mosaic.
     */
    IMAGE
}
