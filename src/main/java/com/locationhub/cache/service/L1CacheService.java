package com.locationhub.cache.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.locationhub.cache.model.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * L1 本地缓存服务
 * 基于 Caffeine，条目按各自的 TTL 过期（见 CaffeineConfig 中的 Expiry）
 * <p>
 * 进程内操作，返回的 Future 均已完成
 */
public class L1CacheService implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(L1CacheService.class);

    private final Cache<String, CacheEntry> localCache;
    private final Clock clock;

    public L1CacheService(Cache<String, CacheEntry> localCache, Clock clock) {
        this.localCache = localCache;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Optional<CacheEntry>> get(String key) {
        CacheEntry entry = localCache.getIfPresent(key);
        if (entry == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (entry.isExpired(clock.instant())) {
            localCache.asMap().remove(key, entry);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.completedFuture(Optional.of(entry));
    }

    @Override
    public CompletableFuture<Void> set(String key, byte[] value, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            localCache.invalidate(key);
            return CompletableFuture.completedFuture(null);
        }
        localCache.put(key, CacheEntry.of(value, ttl, clock.instant()));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> remove(String key) {
        localCache.invalidate(key);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Boolean> exists(String key) {
        return get(key).thenApply(Optional::isPresent);
    }

    /**
     * 获取缓存大小（估算值）
     */
    public long size() {
        return localCache.estimatedSize();
    }

    /**
     * Caffeine 统计信息，未开启 recordStats 时为空统计
     */
    public CacheStats stats() {
        return localCache.stats();
    }

    /**
     * 清空 L1，仅用于运维
     */
    public void invalidateAll() {
        localCache.invalidateAll();
        log.info("L1 cache cleared");
    }
}
