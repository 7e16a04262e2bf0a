package com.locationhub.cache.provider;

import com.locationhub.cache.model.ProviderDescriptor;

import java.util.Objects;

/**
 * 注册表中的一项：能力描述 + 供应商实例
 */
public record RegisteredProvider(ProviderDescriptor descriptor, LocationProvider provider) {

    public RegisteredProvider {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(provider, "provider");
    }

    public String name() {
        return descriptor.name();
    }
}
