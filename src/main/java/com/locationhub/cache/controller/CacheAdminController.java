package com.locationhub.cache.controller;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.locationhub.cache.dto.ApiResponse;
import com.locationhub.cache.provider.ProviderRegistry;
import com.locationhub.cache.service.L1CacheService;
import com.locationhub.cache.service.TwoTierCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 缓存运维管理 API
 * Key 为完整缓存 Key，如 geocode:9f3a1c0b2d4e5f60
 */
@Slf4j
@RestController
@RequestMapping("/api/cache/admin")
@RequiredArgsConstructor
public class CacheAdminController {

    private final TwoTierCacheService twoTierCacheService;
    private final L1CacheService l1CacheService;
    private final ProviderRegistry providerRegistry;

    /**
     * 获取缓存统计信息
     */
    @GetMapping("/stats")
    public ApiResponse<Map<String, Object>> getStats() {
        TwoTierCacheService.CacheStats stats = twoTierCacheService.stats();
        CacheStats l1Stats = l1CacheService.stats();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("l1Hits", stats.l1Hits());
        result.put("l2Hits", stats.l2Hits());
        result.put("misses", stats.misses());
        result.put("hitRate", String.format(Locale.ROOT, "%.2f%%", stats.hitRate() * 100));
        result.put("l1Size", l1CacheService.size());
        result.put("l1EvictionCount", l1Stats.evictionCount());
        result.put("localCap", twoTierCacheService.localCap().toString());
        result.put("defaultTtl", twoTierCacheService.defaultTtl().toString());
        result.put("providers", providerRegistry.names());
        return ApiResponse.success(result);
    }

    /**
     * 检查 Key 是否存在于任一层
     */
    @GetMapping("/exists/{key}")
    public CompletableFuture<ApiResponse<Boolean>> exists(@PathVariable String key) {
        return twoTierCacheService.exists(key).thenApply(ApiResponse::success);
    }

    /**
     * 清空 L1，L2 不受影响
     */
    @DeleteMapping("/l1")
    public ApiResponse<Void> clearLocal() {
        l1CacheService.invalidateAll();
        return ApiResponse.success(null);
    }

    /**
     * 删除两级缓存
     */
    @DeleteMapping("/{key}")
    public CompletableFuture<ApiResponse<Void>> evict(@PathVariable String key) {
        log.info("Evicting cache key: {}", key);
        return twoTierCacheService.remove(key).thenApply(ignored -> ApiResponse.<Void>success(null));
    }
}
