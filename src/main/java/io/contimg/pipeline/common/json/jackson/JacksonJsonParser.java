package io.contimg.pipeline.common.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.contimg.pipeline.common.json.JsonParser;
import io.contimg.pipeline.exception.json.JsonParsingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * {@link JsonParser} backed by the application's Jackson {@link ObjectMapper}.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        if (!StringUtils.hasText(json)) {
            throw new JsonParsingException("Expected a " + valueType.getSimpleName() + " document but got no text", null);
        }
        try {
            T result = objectMapper.readValue(json.strip(), valueType);
            log.trace("Parsed {}: {}", valueType.getSimpleName(), result);
            return result;
        } catch (JsonProcessingException e) {
            log.error("Could not read {} from '{}'", valueType.getSimpleName(), abbreviate(json), e);
            throw new JsonParsingException("Error parsing JSON into " + valueType.getSimpleName(), e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
