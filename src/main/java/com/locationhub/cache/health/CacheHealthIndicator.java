package com.locationhub.cache.health;

import com.locationhub.cache.service.CacheStore;
import com.locationhub.cache.service.L1CacheService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 两级缓存健康检查：各层做一次写-读-删
 */
@Slf4j
@Component("cacheHealthIndicator")
public class CacheHealthIndicator implements HealthIndicator {

    private static final String PROBE_KEY = "health:probe";
    private static final byte[] PROBE_VALUE = "ok".getBytes(StandardCharsets.UTF_8);
    private static final Duration PROBE_TTL = Duration.ofSeconds(10);
    private static final long PROBE_TIMEOUT_MS = 2000;

    private final L1CacheService l1CacheService;
    private final CacheStore backingCacheStore;

    public CacheHealthIndicator(L1CacheService l1CacheService,
                                @Qualifier("backingCacheStore") CacheStore backingCacheStore) {
        this.l1CacheService = l1CacheService;
        this.backingCacheStore = backingCacheStore;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        boolean l1Healthy = check("l1", l1CacheService, details);
        details.put("l1_size", l1CacheService.size());
        boolean l2Healthy = check("l2", backingCacheStore, details);

        if (l1Healthy && l2Healthy) {
            return Health.up().withDetails(details).build();
        }
        return Health.down().withDetails(details).build();
    }

    private boolean check(String tier, CacheStore store, Map<String, Object> details) {
        try {
            store.set(PROBE_KEY, PROBE_VALUE, PROBE_TTL).get(PROBE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            Optional<?> read = store.get(PROBE_KEY).get(PROBE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            store.remove(PROBE_KEY).get(PROBE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            boolean healthy = read.isPresent();
            details.put(tier, healthy ? "UP" : "DOWN");
            return healthy;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            details.put(tier, "DOWN");
            return false;
        } catch (Exception e) {
            log.error("{} cache health check failed", tier, e);
            details.put(tier, "DOWN");
            details.put(tier + "_error", String.valueOf(e.getMessage()));
            return false;
        }
    }
}
