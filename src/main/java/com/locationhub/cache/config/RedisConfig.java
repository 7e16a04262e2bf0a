package com.locationhub.cache.config;

import com.locationhub.cache.service.L2RedisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;

/**
 * Redis 配置（仅 location-cache.l2.type=redis 时生效）
 * 连接参数取自 spring.data.redis.*，Lettuce 响应式客户端
 */
@Configuration
@ConditionalOnProperty(prefix = "location-cache.l2", name = "type", havingValue = "redis")
public class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

    /**
     * Key 用字符串，Value 直接存字节（已由 ValueCodec 序列化）
     */
    @Bean
    public ReactiveRedisTemplate<String, byte[]> locationRedisTemplate(ReactiveRedisConnectionFactory connectionFactory) {
        RedisSerializationContext<String, byte[]> context = RedisSerializationContext
            .<String, byte[]>newSerializationContext(StringRedisSerializer.UTF_8)
            .value(RedisSerializer.byteArray())
            .build();
        log.info("Reactive Redis template initialized for L2 cache");
        return new ReactiveRedisTemplate<>(connectionFactory, context);
    }

    @Bean("backingCacheStore")
    public L2RedisService l2RedisService(ReactiveRedisTemplate<String, byte[]> locationRedisTemplate,
                                         CacheProperties properties,
                                         Clock clock) {
        log.info("L2 cache backed by Redis, keyPrefix={}", properties.getL2().getKeyPrefix());
        return new L2RedisService(locationRedisTemplate, properties.getL2().getKeyPrefix(), clock);
    }
}
