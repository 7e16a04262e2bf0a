package com.locationhub.cache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.locationhub.cache.model.CacheEntry;
import com.locationhub.cache.service.CacheKeyDeriver;
import com.locationhub.cache.service.CacheStore;
import com.locationhub.cache.service.L1CacheService;
import com.locationhub.cache.service.L2MemoryService;
import com.locationhub.cache.service.TwoTierCacheService;
import com.locationhub.cache.service.ValueCodec;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 两级缓存装配
 */
@Configuration
public class LocationCacheConfig {

    private static final Logger log = LoggerFactory.getLogger(LocationCacheConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ValueCodec valueCodec(ObjectMapper objectMapper) {
        return new ValueCodec(objectMapper);
    }

    @Bean
    public CacheKeyDeriver cacheKeyDeriver() {
        return new CacheKeyDeriver();
    }

    @Bean
    public L1CacheService l1CacheService(@Qualifier("locationLocalCache") Cache<String, CacheEntry> localCache,
                                         Clock clock) {
        return new L1CacheService(localCache, clock);
    }

    /**
     * 未配置 Redis 时使用进程内 L2
     */
    @Bean("backingCacheStore")
    @ConditionalOnProperty(prefix = "location-cache.l2", name = "type", havingValue = "memory", matchIfMissing = true)
    public L2MemoryService l2MemoryService(Clock clock) {
        log.info("L2 cache backed by in-process memory store");
        return new L2MemoryService(clock);
    }

    @Bean
    public TwoTierCacheService twoTierCacheService(L1CacheService l1CacheService,
                                                   @Qualifier("backingCacheStore") CacheStore backingCacheStore,
                                                   ValueCodec valueCodec,
                                                   CacheProperties properties,
                                                   Clock clock,
                                                   MeterRegistry meterRegistry) {
        log.info("Two-tier cache initialized: localCap={}, defaultTtl={}",
            properties.getL1().getCap(), properties.getL2().getDefaultTtl());
        return new TwoTierCacheService(
            l1CacheService,
            backingCacheStore,
            valueCodec,
            properties.getL1().getCap(),
            properties.getL2().getDefaultTtl(),
            clock,
            meterRegistry);
    }
}
