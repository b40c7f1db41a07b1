package com.reqsafe.idempotency;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link ResultCodec} storing results as JSON. Results must round-trip through the given mapper.
 */
public final class JacksonResultCodec<T> implements ResultCodec<T> {

    private final ObjectMapper mapper;
    private final JavaType type;

    private JacksonResultCodec(ObjectMapper mapper, JavaType type) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.type = type;
    }

    public static <T> JacksonResultCodec<T> of(ObjectMapper mapper, Class<T> type) {
        return new JacksonResultCodec<>(mapper, mapper.constructType(type));
    }

    public static <T> JacksonResultCodec<T> of(ObjectMapper mapper, TypeReference<T> type) {
        return new JacksonResultCodec<>(mapper, mapper.constructType(type));
    }

    @Override
    public byte[] encode(T value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new IllegalArgumentException("Result of type " + type + " cannot be serialized", e);
        }
    }

    @Override
    public T decode(byte[] payload) {
        try {
            return mapper.readValue(payload, type);
        } catch (IOException e) {
            throw new IllegalStateException("Stored result cannot be read as " + type, e);
        }
    }
}
