package com.locationhub.cache.provider;

import com.locationhub.cache.config.CacheProperties.ProviderSettings;
import com.locationhub.cache.model.ProviderDescriptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 供应商注册表
 * <p>
 * 启动时构建，之后不再变化。按优先级从高到低排序，优先级相同保持声明顺序。
 */
public final class ProviderRegistry {

    private final List<RegisteredProvider> providers;

    public ProviderRegistry(List<RegisteredProvider> entries) {
        Set<String> names = new HashSet<>();
        for (RegisteredProvider entry : entries) {
            if (!names.add(entry.name())) {
                throw new IllegalArgumentException("Duplicate provider name: " + entry.name());
            }
        }
        List<RegisteredProvider> ordered = new ArrayList<>(entries);
        // List.sort 是稳定排序
        ordered.sort(Comparator.comparingInt((RegisteredProvider p) -> p.descriptor().priority()).reversed());
        this.providers = List.copyOf(ordered);
    }

    /**
     * 按给定顺序登记，能力取自供应商自身
     */
    public static ProviderRegistry of(LocationProvider... providers) {
        List<RegisteredProvider> entries = new ArrayList<>();
        int priority = providers.length;
        for (LocationProvider provider : Arrays.asList(providers)) {
            ProviderDescriptor descriptor = new ProviderDescriptor(
                provider.name(), provider.allowsCaching(), provider.cacheTtl().orElse(null), priority--);
            entries.add(new RegisteredProvider(descriptor, provider));
        }
        return new ProviderRegistry(entries);
    }

    /**
     * 按配置登记，跳过未启用的供应商
     */
    public static ProviderRegistry fromSettings(Collection<LocationProvider> providers, List<ProviderSettings> settings) {
        List<RegisteredProvider> entries = new ArrayList<>();
        for (ProviderSettings setting : settings) {
            if (!setting.isEnabled()) {
                continue;
            }
            LocationProvider provider = providers.stream()
                .filter(p -> p.name().equalsIgnoreCase(setting.getName()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                    "No implementation for configured provider: " + setting.getName()));
            entries.add(new RegisteredProvider(describe(provider, setting), provider));
        }
        return new ProviderRegistry(entries);
    }

    static ProviderDescriptor describe(LocationProvider provider, ProviderSettings setting) {
        boolean allowsCaching = provider.allowsCaching()
            && (setting.getAllowsCaching() == null || setting.getAllowsCaching());
        Duration ttl = setting.getCacheTtl() != null
            ? setting.getCacheTtl()
            : provider.cacheTtl().orElse(null);
        return new ProviderDescriptor(provider.name(), allowsCaching, ttl, setting.getPriority());
    }

    public List<RegisteredProvider> providers() {
        return providers;
    }

    public List<String> names() {
        return providers.stream().map(RegisteredProvider::name).toList();
    }

    public int size() {
        return providers.size();
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }
}
