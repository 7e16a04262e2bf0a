package com.locationhub.cache.exception;

/**
 * 缓存值序列化 / 反序列化失败
 */
public class CacheSerializationException extends RuntimeException {

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
