package com.locationhub.cache.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.locationhub.cache.model.CacheEntry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Caffeine 本地缓存配置
 * 采用 W-TinyLFU 淘汰策略，条目按各自的 expiresAt 过期
 */
@Configuration
public class CaffeineConfig {

    private static final Logger log = LoggerFactory.getLogger(CaffeineConfig.class);

    @Bean("locationLocalCache")
    public Cache<String, CacheEntry> locationLocalCache(CacheProperties properties,
                                                        Clock clock,
                                                        MeterRegistry meterRegistry) {
        CacheProperties.L1Config l1 = properties.getL1();
        Caffeine<String, CacheEntry> builder = Caffeine.newBuilder()
            .maximumSize(l1.getMaxSize())
            .expireAfter(new EntryExpiry(clock))
            .removalListener((String key, CacheEntry value, RemovalCause cause) -> {
                if (cause == RemovalCause.SIZE) {
                    log.debug("Cache evicted due to size: key={}", key);
                } else if (cause == RemovalCause.EXPIRED) {
                    log.debug("Cache expired: key={}", key);
                }
            });

        if (l1.isRecordStats()) {
            builder.recordStats();
        }

        Cache<String, CacheEntry> cache = builder.build();
        CaffeineCacheMetrics.monitor(meterRegistry, cache, "location_local_cache");

        log.info("Location local cache initialized: maximumSize={}, cap={}", l1.getMaxSize(), l1.getCap());
        return cache;
    }

    /**
     * 按条目自身的过期时间计算存活时长，读取不延长有效期
     */
    static final class EntryExpiry implements Expiry<String, CacheEntry> {

        private final Clock clock;

        EntryExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
            return nanosUntil(value.expiresAt());
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
            return nanosUntil(value.expiresAt());
        }

        @Override
        public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long nanosUntil(Instant expiresAt) {
            Duration remaining = Duration.between(clock.instant(), expiresAt);
            if (remaining.isNegative()) {
                return 0L;
            }
            try {
                return remaining.toNanos();
            } catch (ArithmeticException e) {
                return Long.MAX_VALUE;
            }
        }
    }
}
