package io.contimg.pipeline.common.json;

/**
 * Writes objects as compact, single-line JSON, suitable for passing on a command line.
 */
public interface JsonSerializer {

    /**
     * @throws io.contimg.pipeline.exception.json.JsonParsingException if the object cannot be written
     */
    <T> String serialize(T object);
}
