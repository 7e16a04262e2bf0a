package com.locationhub.cache.service;

import com.locationhub.cache.model.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 进程内 L2 实现，未配置 Redis 时使用
 * 读取时惰性删除过期条目，另有定时清理
 */
public class L2MemoryService implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(L2MemoryService.class);

    private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public L2MemoryService(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Optional<CacheEntry>> get(String key) {
        return CompletableFuture.completedFuture(liveEntry(key));
    }

    @Override
    public CompletableFuture<Void> set(String key, byte[] value, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            entries.remove(key);
        } else {
            entries.put(key, CacheEntry.of(value, ttl, clock.instant()));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> remove(String key) {
        entries.remove(key);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Boolean> exists(String key) {
        return CompletableFuture.completedFuture(liveEntry(key).isPresent());
    }

    /**
     * 定时清理过期条目
     */
    @Scheduled(fixedDelayString = "#{@cacheProperties.l2.purgeInterval.toMillis()}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int purged = before - entries.size();
        if (purged > 0) {
            log.debug("Purged {} expired entries from memory L2", purged);
        }
    }

    public int size() {
        return entries.size();
    }

    private Optional<CacheEntry> liveEntry(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }
}
