package com.locationhub.cache.service;

import com.locationhub.cache.model.CacheEntry;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 缓存层存储契约，L1 / L2 各有一个实现
 * 已过期的条目一律视为不存在
 */
public interface CacheStore {

    CompletableFuture<Optional<CacheEntry>> get(String key);

    CompletableFuture<Void> set(String key, byte[] value, Duration ttl);

    CompletableFuture<Void> remove(String key);

    CompletableFuture<Boolean> exists(String key);
}
