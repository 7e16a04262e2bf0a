package com.locationhub.cache.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 缓存条目：序列化后的值 + 绝对过期时间
 * 只会整体替换或删除，不做局部修改
 *
 * @param value     序列化字节
 * @param expiresAt 绝对过期时间，{@link Instant#MAX} 表示永不过期
 */
public record CacheEntry(byte[] value, Instant expiresAt) {

    public CacheEntry {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public static CacheEntry of(byte[] value, Duration ttl, Instant now) {
        return new CacheEntry(value, now.plus(ttl));
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * 剩余存活时间，已过期返回 {@link Duration#ZERO}
     */
    public Duration remainingTtl(Instant now) {
        if (isExpired(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, expiresAt);
    }
}
