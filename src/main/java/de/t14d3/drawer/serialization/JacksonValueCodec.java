package de.t14d3.drawer.serialization;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.t14d3.drawer.exceptions.CacheException;

import java.util.Objects;

/**
 * Jackson implementation of ValueCodec. Payloads are JSON text.
 */
public final class JacksonValueCodec implements ValueCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     */
    public JacksonValueCodec() {
        this(new ObjectMapper(new JsonFactory()));
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonValueCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public String encode(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new CacheException("Failed to serialize value of type "
                    + (value == null ? "null" : value.getClass().getName()), e);
        }
    }

    @Override
    public Object decode(String payload) {
        if (payload == null) {
            return null;
        }
        try {
            return mapper.readValue(payload, Object.class);
        } catch (Exception e) {
            throw new CacheException("Failed to deserialize stored value", e);
        }
    }

    @Override
    public Object fromModel(Object model) {
        try {
            return mapper.convertValue(model, Object.class);
        } catch (IllegalArgumentException e) {
            throw new CacheException("Failed to convert model " + model.getClass().getName(), e);
        }
    }

    @Override
    public <T> T toModel(Object value, Class<T> type) {
        try {
            return mapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new CacheException("Failed to convert stored value to " + type.getName(), e);
        }
    }
}
