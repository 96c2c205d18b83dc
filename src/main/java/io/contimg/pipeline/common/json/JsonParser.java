package io.contimg.pipeline.common.json;

/**
 * Reads JSON documents, such as the engine's stdout, into typed objects.
 */
public interface JsonParser {

    /**
     * @throws io.contimg.pipeline.exception.json.JsonParsingException if the text is blank or not a valid
     *                                                                  document of the requested type
     */
    <T> T parseObject(String json, Class<T> valueType);
}
