package io.github.flameyossnowy.kvmodels.api.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.flameyossnowy.kvmodels.api.exceptions.json.JacksonJsonLocation;
import io.github.flameyossnowy.kvmodels.api.exceptions.json.JsonProcessException;
import org.jetbrains.annotations.NotNull;

/**
 * Jackson-backed codec shared by record bodies and JSON-typed fields.
 * <p>
 * Floating point numbers are read as {@code Double}, integral numbers as {@code Integer} or {@code Long}
 * depending on magnitude, objects as insertion-ordered maps.
 */
public class DefaultJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    public DefaultJsonCodec() {
        this(new ObjectMapper().disable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
    }

    public DefaultJsonCodec(@NotNull ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String serialize(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JsonProcessException(e.getOriginalMessage(), e, JacksonJsonLocation.from(e.getLocation()));
        }
    }

    @Override
    public <T> T deserialize(String json, Class<T> targetType) {
        try {
            return mapper.readValue(json, targetType);
        } catch (JsonProcessingException e) {
            throw new JsonProcessException(e.getOriginalMessage(), e, JacksonJsonLocation.from(e.getLocation()));
        }
    }
}
