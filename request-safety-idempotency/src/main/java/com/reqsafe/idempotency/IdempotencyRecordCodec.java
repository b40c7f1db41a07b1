package com.reqsafe.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.reqsafe.idempotency.store.StoreUnavailableException;

/**
 * JSON form of {@link IdempotencyRecord} as stored in the {@link com.reqsafe.idempotency.store.KeyValueStore}.
 */
final class IdempotencyRecordCodec {

    private final ObjectMapper mapper;

    IdempotencyRecordCodec() {
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    String write(IdempotencyRecord record) {
        try {
            return mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize idempotency record", e);
        }
    }

    IdempotencyRecord read(String storageKey, String json) {
        try {
            return mapper.readValue(json, IdempotencyRecord.class);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Unreadable idempotency record at " + storageKey, e);
        }
    }
}
