package io.contimg.pipeline.service.engine;

/**
 * A single 2-D image plane in row-major order. Blanked pixels are NaN.
 */
public record ImagePlane(int width, int height, double[] pixels) {

    public ImagePlane {
        if (width <= 0 || height <= 0 || pixels == null || pixels.length != width * height) {
            throw new IllegalArgumentException("Pixel buffer does not match a " + width + "x" + height + " plane");
        }
    }

    public double get(int x, int y) {
        return pixels[y * width + x];
    }
}
