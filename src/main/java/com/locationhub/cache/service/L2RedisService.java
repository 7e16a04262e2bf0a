package com.locationhub.cache.service;

import com.locationhub.cache.model.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * L2 Redis 共享缓存服务
 * 基于 Lettuce 响应式客户端，过期交给 Redis 自身的 TTL
 * <p>
 * 本类不吞异常，故障降级由 {@link TwoTierCacheService} 统一处理
 */
public class L2RedisService implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(L2RedisService.class);

    private final ReactiveRedisTemplate<String, byte[]> redisTemplate;
    private final String keyPrefix;
    private final Clock clock;

    public L2RedisService(ReactiveRedisTemplate<String, byte[]> redisTemplate, String keyPrefix, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
        this.clock = clock;
    }

    /**
     * 读取值及剩余 TTL，用于回填 L1
     */
    @Override
    public CompletableFuture<Optional<CacheEntry>> get(String key) {
        String redisKey = redisKey(key);
        Mono<byte[]> value = redisTemplate.opsForValue().get(redisKey);
        // PTTL -1（无过期）映射为 Duration.ZERO；-2（两次命令之间已过期）映射为空
        Mono<Optional<Duration>> ttl = redisTemplate.getExpire(redisKey)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());
        return value.zipWith(ttl)
            .map(tuple -> tuple.getT2().flatMap(remaining -> toEntry(tuple.getT1(), remaining)))
            .defaultIfEmpty(Optional.empty())
            .toFuture();
    }

    @Override
    public CompletableFuture<Void> set(String key, byte[] value, Duration ttl) {
        String redisKey = redisKey(key);
        return redisTemplate.opsForValue().set(redisKey, value, ttl)
            .doOnNext(written -> {
                if (!Boolean.TRUE.equals(written)) {
                    log.warn("Redis set not acknowledged, key: {}", redisKey);
                }
            })
            .then()
            .toFuture();
    }

    @Override
    public CompletableFuture<Void> remove(String key) {
        return redisTemplate.delete(redisKey(key)).then().toFuture();
    }

    @Override
    public CompletableFuture<Boolean> exists(String key) {
        return redisTemplate.hasKey(redisKey(key)).defaultIfEmpty(false).toFuture();
    }

    private Optional<CacheEntry> toEntry(byte[] value, Duration ttl) {
        if (ttl.isNegative()) {
            return Optional.empty();
        }
        Instant expiresAt = ttl.isZero() ? Instant.MAX : clock.instant().plus(ttl);
        return Optional.of(new CacheEntry(value, expiresAt));
    }

    private String redisKey(String key) {
        return keyPrefix + key;
    }
}
