package com.locationhub.cache.controller;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.locationhub.cache.provider.ProviderRegistry;
import com.locationhub.cache.service.L1CacheService;
import com.locationhub.cache.service.TwoTierCacheService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 缓存运维 API 测试
 */
@WebMvcTest(CacheAdminController.class)
class CacheAdminControllerTest {

    private static final String KEY = "geocode:0123456789abcdef";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TwoTierCacheService twoTierCacheService;

    @MockBean
    private L1CacheService l1CacheService;

    @MockBean
    private ProviderRegistry providerRegistry;

    @Test
    @DisplayName("缓存统计")
    void testStats() throws Exception {
        when(twoTierCacheService.stats()).thenReturn(new TwoTierCacheService.CacheStats(6, 2, 2));
        when(twoTierCacheService.localCap()).thenReturn(Duration.ofMinutes(5));
        when(twoTierCacheService.defaultTtl()).thenReturn(Duration.ofHours(1));
        when(l1CacheService.size()).thenReturn(42L);
        when(l1CacheService.stats()).thenReturn(CacheStats.empty());
        when(providerRegistry.names()).thenReturn(List.of("HERE", "TomTom"));

        mockMvc.perform(get("/api/cache/admin/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.l1Hits").value(6))
            .andExpect(jsonPath("$.data.hitRate").value("80.00%"))
            .andExpect(jsonPath("$.data.l1Size").value(42))
            .andExpect(jsonPath("$.data.localCap").value("PT5M"))
            .andExpect(jsonPath("$.data.providers[0]").value("HERE"));
    }

    @Test
    @DisplayName("检查 Key 是否存在")
    void testExists() throws Exception {
        when(twoTierCacheService.exists(KEY)).thenReturn(CompletableFuture.completedFuture(true));

        MvcResult result = mockMvc.perform(get("/api/cache/admin/exists/" + KEY))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").value(true));
    }

    @Test
    @DisplayName("删除 Key")
    void testEvict() throws Exception {
        when(twoTierCacheService.remove(KEY)).thenReturn(CompletableFuture.completedFuture(null));

        MvcResult result = mockMvc.perform(delete("/api/cache/admin/" + KEY))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(200));
        verify(twoTierCacheService).remove(KEY);
    }

    @Test
    @DisplayName("清空 L1")
    void testClearLocal() throws Exception {
        mockMvc.perform(delete("/api/cache/admin/l1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(200));
        verify(l1CacheService).invalidateAll();
    }
}
