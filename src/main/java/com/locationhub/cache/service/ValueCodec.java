package com.locationhub.cache.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationhub.cache.exception.CacheSerializationException;

import java.io.IOException;

/**
 * 缓存值编解码（Jackson JSON）
 */
public class ValueCodec {

    private final ObjectMapper objectMapper;

    public ValueCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public <V> V decode(byte[] bytes, Class<V> type) {
        try {
            return objectMapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new CacheSerializationException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
