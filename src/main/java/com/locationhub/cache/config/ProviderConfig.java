package com.locationhub.cache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationhub.cache.config.CacheProperties.ProviderSettings;
import com.locationhub.cache.provider.HereLocationProvider;
import com.locationhub.cache.provider.LocationProvider;
import com.locationhub.cache.provider.ProviderRegistry;
import com.locationhub.cache.provider.TomTomLocationProvider;
import com.locationhub.cache.service.CacheKeyDeriver;
import com.locationhub.cache.service.LocationAggregationService;
import com.locationhub.cache.service.LocationService;
import com.locationhub.cache.service.TwoTierCacheService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 供应商装配：按配置创建供应商实例，构建注册表，显式注入编排服务
 */
@Configuration
public class ProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(ProviderConfig.class);

    @Bean
    public ProviderRegistry providerRegistry(CacheProperties properties,
                                             WebClient.Builder webClientBuilder,
                                             ObjectMapper objectMapper,
                                             Clock clock) {
        List<LocationProvider> providers = new ArrayList<>();
        for (ProviderSettings settings : properties.getProviders()) {
            if (!settings.isEnabled()) {
                log.info("Provider {} disabled by configuration", settings.getName());
                continue;
            }
            providers.add(createProvider(settings, webClientBuilder, objectMapper, clock));
        }
        ProviderRegistry registry = ProviderRegistry.fromSettings(providers, properties.getProviders());
        if (registry.isEmpty()) {
            log.warn("No location providers configured, every lookup will be served from cache only");
        } else {
            log.info("Registered {} location providers in order: {}", registry.size(), registry.names());
        }
        return registry;
    }

    @Bean
    public LocationService locationService(ProviderRegistry providerRegistry,
                                           TwoTierCacheService twoTierCacheService,
                                           CacheKeyDeriver cacheKeyDeriver,
                                           Clock clock,
                                           MeterRegistry meterRegistry) {
        return new LocationAggregationService(providerRegistry, twoTierCacheService, cacheKeyDeriver, clock, meterRegistry);
    }

    private LocationProvider createProvider(ProviderSettings settings,
                                            WebClient.Builder webClientBuilder,
                                            ObjectMapper objectMapper,
                                            Clock clock) {
        return switch (settings.getName().toLowerCase(Locale.ROOT)) {
            case "here" -> new HereLocationProvider(webClientBuilder, objectMapper, settings, clock);
            case "tomtom" -> new TomTomLocationProvider(webClientBuilder, objectMapper, settings, clock);
            default -> throw new IllegalStateException("Unsupported location provider: " + settings.getName());
        };
    }
}
