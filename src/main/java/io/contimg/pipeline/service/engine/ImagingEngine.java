package io.contimg.pipeline.service.engine;

/**
 * Port to the external imaging/calibration engine that does the actual conversion, calibration, imaging and
 * combination work.
 */
public interface ImagingEngine {

    /**
     * Runs one engine operation. Failures the engine reports are returned as {@link EngineResult.Failure},
     * never thrown.
     */
    EngineResult invoke(EngineRequest request);

    /**
     * Reads the first plane of an image product for validation.
     *
     * @throws io.contimg.pipeline.exception.TransientProcessingException if the image could not be read
     */
    ImagePlane readImagePlane(String path);
}
