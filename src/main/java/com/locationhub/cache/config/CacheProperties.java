package com.locationhub.cache.config;

import com.locationhub.cache.constant.CacheConstants;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 缓存与供应商配置属性类
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "location-cache")
public class CacheProperties {

    /** L1 本地缓存配置 */
    @Valid
    private L1Config l1 = new L1Config();

    /** L2 共享缓存配置 */
    @Valid
    private L2Config l2 = new L2Config();

    /** 健康检查配置 */
    @Valid
    private HealthConfig health = new HealthConfig();

    /** 供应商列表，按声明顺序登记 */
    @Valid
    private List<ProviderSettings> providers = new ArrayList<>();

    @Data
    public static class L1Config {
        /** 最大条目数 */
        private long maxSize = 10_000;
        /** 单条 TTL 上限 */
        private Duration cap = CacheConstants.DEFAULT_LOCAL_CAP;
        /** 是否开启统计 */
        private boolean recordStats = true;
    }

    @Data
    public static class L2Config {
        /** redis 或 memory */
        private BackingType type = BackingType.MEMORY;
        /** 默认过期时间 */
        private Duration defaultTtl = CacheConstants.DEFAULT_BACKING_TTL;
        /** Redis Key 前缀 */
        private String keyPrefix = CacheConstants.DEFAULT_REDIS_KEY_PREFIX;
        /** 内存 L2 过期条目清理间隔，Redis 模式下不使用 */
        private Duration purgeInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class HealthConfig {
        /** 供应商探活的最小间隔，期间复用上次结果（每次探活都是一次计费调用） */
        private Duration providerProbeInterval = Duration.ofMinutes(5);
    }

    public enum BackingType {
        REDIS,
        MEMORY
    }

    @Data
    public static class ProviderSettings {
        /** 供应商名称（here / tomtom，不区分大小写） */
        @NotBlank
        private String name;
        /** 是否启用 */
        private boolean enabled = true;
        /** 优先级，数值越大越先尝试 */
        private int priority;
        /** 只能收紧：供应商本身禁止缓存时此项无效 */
        private Boolean allowsCaching;
        /** 覆盖供应商自身的缓存时间 */
        private Duration cacheTtl;
        /** API Key */
        private String apiKey;
        /** 覆盖默认接口地址 */
        private String baseUrl;
        /** 路线接口地址（HERE 的路线服务与地理编码分开部署） */
        private String routingUrl;
        /** 单次请求超时 */
        private Duration timeout = Duration.ofSeconds(10);
    }
}
