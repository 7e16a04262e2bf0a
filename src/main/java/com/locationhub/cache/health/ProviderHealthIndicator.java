package com.locationhub.cache.health;

import com.locationhub.cache.config.CacheProperties;
import com.locationhub.cache.service.LocationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 供应商健康检查
 * 至少一个供应商可用即为 UP，未配置供应商时为 UNKNOWN
 * <p>
 * 探活间隔内直接返回上次结果
 */
@Slf4j
@Component("providerHealthIndicator")
public class ProviderHealthIndicator implements HealthIndicator {

    private static final long TIMEOUT_SECONDS = 15;

    private final LocationService locationService;
    private final Duration probeInterval;
    private final Clock clock;

    private Health lastHealth;
    private Instant lastProbeAt;

    public ProviderHealthIndicator(LocationService locationService, CacheProperties cacheProperties, Clock clock) {
        this.locationService = locationService;
        this.probeInterval = cacheProperties.getHealth().getProviderProbeInterval();
        this.clock = clock;
    }

    @Override
    public synchronized Health health() {
        Instant now = clock.instant();
        if (lastHealth != null && now.isBefore(lastProbeAt.plus(probeInterval))) {
            return lastHealth;
        }
        lastHealth = probe();
        lastProbeAt = now;
        return lastHealth;
    }

    private Health probe() {
        try {
            Map<String, Boolean> snapshot = locationService.getProvidersHealth().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (snapshot.isEmpty()) {
                return Health.unknown().withDetail("providers", "none configured").build();
            }
            Health.Builder builder = snapshot.containsValue(true) ? Health.up() : Health.down();
            snapshot.forEach((name, healthy) -> builder.withDetail(name, healthy ? "UP" : "DOWN"));
            return builder.build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Health.down(e).build();
        } catch (Exception e) {
            log.error("Provider health check failed", e);
            return Health.down(e).build();
        }
    }
}
