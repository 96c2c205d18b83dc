package io.contimg.pipeline.common.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.contimg.pipeline.common.json.JsonSerializer;
import io.contimg.pipeline.exception.json.JsonParsingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    @Override
    public <T> String serialize(T object) {
        try {
            String json = objectMapper.writeValueAsString(object);
            log.trace("Serialized {} to {}", object == null ? "null" : object.getClass().getSimpleName(), json);
            return json;
        } catch (JsonProcessingException e) {
            throw new JsonParsingException("Could not write " + object.getClass().getSimpleName() + " as JSON", e);
        }
    }
}
