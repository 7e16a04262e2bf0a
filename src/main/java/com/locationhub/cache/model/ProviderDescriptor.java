package com.locationhub.cache.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 供应商能力描述，启动时由配置生成，进程内不可变
 *
 * @param name          供应商名称（注册表内唯一）
 * @param allowsCaching 是否允许缓存其结果
 * @param cacheTtl      偏好的缓存时间，可为 null（使用 L2 默认值）
 * @param priority      优先级，数值越大越先尝试
 */
public record ProviderDescriptor(String name, boolean allowsCaching, Duration cacheTtl, int priority) {

    public ProviderDescriptor {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        if (cacheTtl != null && (cacheTtl.isNegative() || cacheTtl.isZero())) {
            throw new IllegalArgumentException("Cache TTL must be positive for provider " + name);
        }
    }
}
