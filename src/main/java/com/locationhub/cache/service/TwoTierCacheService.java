package com.locationhub.cache.service;

import com.locationhub.cache.exception.CacheSerializationException;
import com.locationhub.cache.model.CacheEntry;
import com.locationhub.cache.util.CancellationScope;
import com.locationhub.cache.util.FutureSupport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static com.locationhub.cache.constant.CacheConstants.TIER_BACKING;
import static com.locationhub.cache.constant.CacheConstants.TIER_LOCAL;

/**
 * 两级缓存门面
 * <p>
 * 读：L1 -> L2（命中后回填 L1，TTL 取 L2 剩余时间与 L1 上限的较小值）
 * 写：L1 写入 min(ttl, L1 上限)，L2 写入完整 ttl，两边互不影响
 * <p>
 * 任一层故障只记录日志：读降级为未命中，写降级为空操作。取消不会被吞掉。
 */
public class TwoTierCacheService {

    private static final Logger log = LoggerFactory.getLogger(TwoTierCacheService.class);

    private final CacheStore localStore;
    private final CacheStore backingStore;
    private final ValueCodec codec;
    private final Duration localCap;
    private final Duration defaultTtl;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Counter l1HitCounter;
    private final Counter l2HitCounter;
    private final Counter missCounter;

    public TwoTierCacheService(CacheStore localStore,
                               CacheStore backingStore,
                               ValueCodec codec,
                               Duration localCap,
                               Duration defaultTtl,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        this.localStore = localStore;
        this.backingStore = backingStore;
        this.codec = codec;
        this.localCap = localCap;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        this.l1HitCounter = Counter.builder("location.cache.l1.hits")
            .description("Local tier hits")
            .register(meterRegistry);
        this.l2HitCounter = Counter.builder("location.cache.l2.hits")
            .description("Backing tier hits")
            .register(meterRegistry);
        this.missCounter = Counter.builder("location.cache.misses")
            .description("Misses on both tiers")
            .register(meterRegistry);
    }

    /**
     * 读取缓存
     */
    public <V> CompletableFuture<Optional<V>> get(String key, Class<V> type) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(type, "type");

        CancellationScope<Optional<V>> scope = new CancellationScope<>();
        readTier(scope, localStore, TIER_LOCAL, key).whenComplete((local, localError) -> {
            if (localError != null) {
                scope.fail(localError);
                return;
            }
            Optional<V> localValue = decodeLive(key, local, type);
            if (localValue.isPresent()) {
                l1HitCounter.increment();
                log.debug("L1 hit: {}", key);
                scope.complete(localValue);
                return;
            }
            if (scope.isDone()) {
                return;
            }
            readTier(scope, backingStore, TIER_BACKING, key).whenComplete((backing, backingError) -> {
                if (backingError != null) {
                    scope.fail(backingError);
                    return;
                }
                Instant now = clock.instant();
                Optional<V> backingValue = decodeLive(key, backing, type);
                if (backingValue.isEmpty()) {
                    missCounter.increment();
                    log.debug("Cache miss: {}", key);
                    scope.complete(Optional.empty());
                    return;
                }
                l2HitCounter.increment();
                log.debug("L2 hit: {}", key);

                CacheEntry entry = backing.get();
                Duration localTtl = min(entry.remainingTtl(now), localCap);
                writeTier(localStore, TIER_LOCAL, key, entry.value(), localTtl)
                    .whenComplete((ignored, backfillError) -> scope.complete(backingValue));
            });
        });
        return scope.result();
    }

    /**
     * 写入缓存，ttl 为 null 时使用 L2 默认过期时间
     */
    public CompletableFuture<Void> set(String key, Object value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        if (effectiveTtl.isNegative() || effectiveTtl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + effectiveTtl);
        }

        byte[] bytes;
        try {
            bytes = codec.encode(value);
        } catch (CacheSerializationException e) {
            log.error("Cache encode error, key: {}", key, e);
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> local = writeTier(localStore, TIER_LOCAL, key, bytes, min(effectiveTtl, localCap));
        CompletableFuture<Void> backing = writeTier(backingStore, TIER_BACKING, key, bytes, effectiveTtl);
        return CompletableFuture.allOf(local, backing);
    }

    /**
     * 删除两级缓存，任一层不存在或故障都不影响另一层
     */
    public CompletableFuture<Void> remove(String key) {
        Objects.requireNonNull(key, "key");
        CompletableFuture<Void> local = absorb(FutureSupport.invoke(() -> localStore.remove(key)), TIER_LOCAL, "remove", key, null);
        CompletableFuture<Void> backing = absorb(FutureSupport.invoke(() -> backingStore.remove(key)), TIER_BACKING, "remove", key, null);
        return CompletableFuture.allOf(local, backing);
    }

    /**
     * 任一层存在未过期条目即返回 true
     */
    public CompletableFuture<Boolean> exists(String key) {
        Objects.requireNonNull(key, "key");
        return absorb(FutureSupport.invoke(() -> localStore.exists(key)), TIER_LOCAL, "exists", key, false)
            .thenCompose(inLocal -> Boolean.TRUE.equals(inLocal)
                ? CompletableFuture.completedFuture(true)
                : absorb(FutureSupport.invoke(() -> backingStore.exists(key)), TIER_BACKING, "exists", key, false)
                    .thenApply(Boolean.TRUE::equals));
    }

    /**
     * 命中统计快照
     */
    public CacheStats stats() {
        return new CacheStats((long) l1HitCounter.count(), (long) l2HitCounter.count(), (long) missCounter.count());
    }

    public Duration localCap() {
        return localCap;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    private <V> Optional<V> decodeLive(String key, Optional<CacheEntry> entry, Class<V> type) {
        if (entry.isEmpty() || entry.get().isExpired(clock.instant())) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(codec.decode(entry.get().value(), type));
        } catch (CacheSerializationException e) {
            log.warn("Undecodable cache entry treated as miss, key: {}", key, e);
            return Optional.empty();
        }
    }

    private CompletableFuture<Optional<CacheEntry>> readTier(CancellationScope<?> scope,
                                                             CacheStore store,
                                                             String tier,
                                                             String key) {
        CompletableFuture<Optional<CacheEntry>> read = scope.track(FutureSupport.invoke(() -> store.get(key)));
        return absorb(read, tier, "get", key, Optional.<CacheEntry>empty())
            .thenApply(entry -> entry != null ? entry : Optional.<CacheEntry>empty());
    }

    private CompletableFuture<Void> writeTier(CacheStore store, String tier, String key, byte[] bytes, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            return CompletableFuture.completedFuture(null);
        }
        return absorb(FutureSupport.invoke(() -> store.set(key, bytes, ttl)), tier, "set", key, null);
    }

    /**
     * 层故障转为兜底值并记录，取消原样抛出
     */
    private <T> CompletableFuture<T> absorb(CompletableFuture<T> operation, String tier, String op, String key, T fallback) {
        return operation.handle((value, error) -> {
            if (error == null) {
                return value;
            }
            FutureSupport.rethrowIfCancelled(error);
            Counter.builder("location.cache.tier.failures")
                .tag("tier", tier)
                .tag("op", op)
                .register(meterRegistry)
                .increment();
            log.warn("Cache {} {} error, key: {}", tier, op, key, FutureSupport.unwrap(error));
            return fallback;
        });
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /**
     * 缓存命中统计
     */
    public record CacheStats(long l1Hits, long l2Hits, long misses) {

        public double hitRate() {
            long total = l1Hits + l2Hits + misses;
            return total == 0 ? 0.0 : (double) (l1Hits + l2Hits) / total;
        }
    }
}
