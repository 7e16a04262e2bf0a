package com.locationhub.cache.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.locationhub.cache.dto.Coordinates;
import com.locationhub.cache.dto.GeocodeResult;
import com.locationhub.cache.dto.RouteResult;
import com.locationhub.cache.model.CacheEntry;
import com.locationhub.cache.provider.LocationProvider;
import com.locationhub.cache.provider.ProviderException;
import com.locationhub.cache.provider.ProviderRegistry;
import com.locationhub.cache.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * 位置查询编排测试
 */
class LocationAggregationServiceTest {

    private static final Duration LOCAL_CAP = Duration.ofMinutes(5);
    private static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private final Coordinates london = new Coordinates(51.5074, -0.1278);
    private final Coordinates paris = new Coordinates(48.8566, 2.3522);

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private CacheKeyDeriver keyDeriver;
    private TwoTierCacheService cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();
        keyDeriver = new CacheKeyDeriver();
        cache = new TwoTierCacheService(
            new L1CacheService(Caffeine.newBuilder().maximumSize(100).<String, CacheEntry>build(), clock),
            new L2MemoryService(clock),
            new ValueCodec(new ObjectMapper().registerModule(new JavaTimeModule())),
            LOCAL_CAP,
            DEFAULT_TTL,
            clock,
            meterRegistry);
    }

    @Test
    @DisplayName("可缓存供应商的结果写入缓存，第二次请求不再调用供应商")
    void testCacheableResultServedFromCache() {
        LocationProvider here = provider("HERE", true, Duration.ofHours(6));
        when(here.geocode("London")).thenReturn(CompletableFuture.completedFuture(geocoded("London", "HERE")));
        LocationAggregationService service = service(here);

        GeocodeResult first = service.geocode("London").join();
        GeocodeResult second = service.geocode("London").join();

        assertEquals("HERE", first.getProviderName());
        assertEquals(first, second);
        verify(here, times(1)).geocode("London");
        assertTrue(cache.exists(keyDeriver.forGeocode("London")).join());
    }

    @Test
    @DisplayName("禁止缓存的供应商结果不写入任何一层")
    void testNonCacheableResultNeverCached() {
        LocationProvider tomtom = provider("TomTom", false, null);
        when(tomtom.geocode("Paris")).thenReturn(CompletableFuture.completedFuture(geocoded("Paris", "TomTom")));
        LocationAggregationService service = service(tomtom);

        assertEquals("TomTom", service.geocode("Paris").join().getProviderName());
        assertEquals("TomTom", service.geocode("Paris").join().getProviderName());

        verify(tomtom, times(2)).geocode("Paris");
        assertFalse(cache.exists(keyDeriver.forGeocode("Paris")).join());
    }

    @Test
    @DisplayName("首个供应商失败时降级到下一个，并按后者的 TTL 缓存")
    void testFallbackUsesSecondProviderTtl() {
        LocationProvider primary = provider("Primary", true, Duration.ofHours(6));
        LocationProvider secondary = provider("Secondary", true, Duration.ofMinutes(30));
        when(primary.geocode("Berlin"))
            .thenReturn(CompletableFuture.failedFuture(new ProviderException("Primary", "HTTP 500")));
        when(secondary.geocode("Berlin")).thenReturn(CompletableFuture.completedFuture(geocoded("Berlin", "Secondary")));
        LocationAggregationService service = service(primary, secondary);

        assertEquals("Secondary", service.geocode("Berlin").join().getProviderName());

        String key = keyDeriver.forGeocode("Berlin");
        clock.advance(Duration.ofMinutes(29));
        assertTrue(cache.exists(key).join());
        clock.advance(Duration.ofMinutes(1));
        assertFalse(cache.exists(key).join());
    }

    @Test
    @DisplayName("所有供应商失败时返回 None 结果且不写缓存")
    void testAllProvidersFail() {
        LocationProvider first = provider("First", true, null);
        LocationProvider second = provider("Second", true, null);
        when(first.geocode(anyString())).thenReturn(CompletableFuture.failedFuture(new ProviderException("First", "timeout")));
        when(second.geocode(anyString())).thenThrow(new IllegalStateException("client not initialized"));
        LocationAggregationService service = service(first, second);

        GeocodeResult result = service.geocode("Nowhere").join();

        assertEquals("None", result.getProviderName());
        assertEquals("Nowhere", result.getAddress());
        assertNull(result.getCoordinates());
        assertFalse(cache.exists(keyDeriver.forGeocode("Nowhere")).join());
        assertEquals(1.0, meterRegistry.get("location.provider.exhausted").tag("operation", "geocode").counter().count());
    }

    @Test
    @DisplayName("没有坐标的结果视为不可用，继续尝试下一个")
    void testEmptyResultFallsThrough() {
        LocationProvider first = provider("First", true, null);
        LocationProvider second = provider("Second", true, null);
        when(first.geocode("Madrid")).thenReturn(CompletableFuture.completedFuture(
            GeocodeResult.builder().address("Madrid").providerName("First").build()));
        when(second.geocode("Madrid")).thenReturn(CompletableFuture.completedFuture(geocoded("Madrid", "Second")));
        LocationAggregationService service = service(first, second);

        assertEquals("Second", service.geocode("Madrid").join().getProviderName());
        assertEquals(1.0, meterRegistry.get("location.provider.attempts")
            .tag("provider", "First").tag("outcome", "empty").counter().count());
    }

    @Test
    @DisplayName("成功后不再调用后面的供应商")
    void testStopsAfterFirstSuccess() {
        LocationProvider first = provider("First", true, null);
        LocationProvider second = provider("Second", true, null);
        when(first.geocode("Rome")).thenReturn(CompletableFuture.completedFuture(geocoded("Rome", "First")));
        LocationAggregationService service = service(first, second);

        service.geocode("Rome").join();

        verify(second, never()).geocode(anyString());
    }

    @Test
    @DisplayName("缓存命中时不调用任何供应商")
    void testCacheHitSkipsProviders() {
        LocationProvider here = provider("HERE", true, null);
        GeocodeResult cached = geocoded("Oslo", "HERE");
        cache.set(keyDeriver.forGeocode("oslo"), cached, null).join();
        LocationAggregationService service = service(here);

        assertEquals(cached, service.geocode("  OSLO ").join());
        verify(here, never()).geocode(anyString());
    }

    @Test
    @DisplayName("供应商没有 TTL 时使用 L2 默认过期时间")
    void testDefaultTtlWhenProviderHasNone() {
        LocationProvider provider = provider("NoTtl", true, null);
        when(provider.geocode("Vienna")).thenReturn(CompletableFuture.completedFuture(geocoded("Vienna", "NoTtl")));
        LocationAggregationService service = service(provider);

        service.geocode("Vienna").join();

        String key = keyDeriver.forGeocode("Vienna");
        clock.advance(Duration.ofMinutes(59));
        assertTrue(cache.exists(key).join());
        clock.advance(Duration.ofMinutes(1));
        assertFalse(cache.exists(key).join());
    }

    @Test
    @DisplayName("逆地理编码：无格式化地址视为不可用；全部失败时结果带坐标")
    void testReverseGeocode() {
        LocationProvider first = provider("First", true, null);
        when(first.reverseGeocode(london)).thenReturn(CompletableFuture.completedFuture(
            GeocodeResult.builder().coordinates(london).formattedAddress(" ").providerName("First").build()));
        LocationAggregationService service = service(first);

        GeocodeResult result = service.reverseGeocode(london).join();

        assertEquals("None", result.getProviderName());
        assertEquals(london, result.getCoordinates());
    }

    @Test
    @DisplayName("逆地理编码成功并缓存")
    void testReverseGeocodeCached() {
        LocationProvider here = provider("HERE", true, Duration.ofHours(6));
        when(here.reverseGeocode(london)).thenReturn(CompletableFuture.completedFuture(
            GeocodeResult.builder().coordinates(london).formattedAddress("Westminster, London").providerName("HERE").build()));
        LocationAggregationService service = service(here);

        assertEquals("Westminster, London", service.reverseGeocode(london).join().getFormattedAddress());
        assertEquals("Westminster, London",
            service.reverseGeocode(new Coordinates(51.50740000001, -0.1278)).join().getFormattedAddress());
        verify(here, times(1)).reverseGeocode(any());
    }

    @Test
    @DisplayName("路线：距离为 0 视为不可用；全部失败时结果带起终点")
    void testRouteFallbackAndSentinel() {
        LocationProvider first = provider("First", true, null);
        LocationProvider second = provider("Second", false, null);
        when(first.route(london, paris)).thenReturn(CompletableFuture.completedFuture(
            RouteResult.builder().origin(london).destination(paris).distanceMeters(0).providerName("First").build()));
        when(second.route(london, paris)).thenReturn(CompletableFuture.completedFuture(
            RouteResult.builder().origin(london).destination(paris).distanceMeters(343_000)
                .duration(Duration.ofHours(5)).providerName("Second").build()));
        LocationAggregationService service = service(first, second);

        RouteResult route = service.route(london, paris).join();
        assertEquals("Second", route.getProviderName());
        assertEquals(343_000, route.getDistanceMeters());

        RouteResult none = service(first).route(london, paris).join();
        assertEquals("None", none.getProviderName());
        assertEquals(london, none.getOrigin());
        assertEquals(paris, none.getDestination());
    }

    @Test
    @DisplayName("L2 故障时供应商结果仍正常返回")
    void testBackingFailureDoesNotFailRequest() {
        CacheStore broken = mock(CacheStore.class);
        when(broken.get(anyString())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("redis down")));
        when(broken.set(anyString(), any(), any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("redis down")));
        TwoTierCacheService degraded = new TwoTierCacheService(
            new L1CacheService(Caffeine.newBuilder().maximumSize(10).<String, CacheEntry>build(), clock),
            broken,
            new ValueCodec(new ObjectMapper().registerModule(new JavaTimeModule())),
            LOCAL_CAP, DEFAULT_TTL, clock, meterRegistry);
        LocationProvider here = provider("HERE", true, null);
        when(here.geocode("Lisbon")).thenReturn(CompletableFuture.completedFuture(geocoded("Lisbon", "HERE")));
        LocationAggregationService service = new LocationAggregationService(
            ProviderRegistry.of(here), degraded, keyDeriver, clock, meterRegistry);

        assertEquals("HERE", service.geocode("Lisbon").join().getProviderName());
    }

    @Test
    @DisplayName("没有供应商时直接返回 None 结果")
    void testEmptyRegistry() {
        LocationAggregationService service = service();

        assertEquals("None", service.geocode("Anywhere").join().getProviderName());
        assertTrue(service.getProvidersHealth().join().isEmpty());
    }

    @Test
    @DisplayName("取消请求时取消正在进行的供应商调用，且不再尝试后续供应商")
    void testCancellation() {
        LocationProvider slow = provider("Slow", true, null);
        LocationProvider next = provider("Next", true, null);
        CompletableFuture<GeocodeResult> pending = new CompletableFuture<>();
        when(slow.geocode("Tokyo")).thenReturn(pending);
        LocationAggregationService service = service(slow, next);

        CompletableFuture<GeocodeResult> result = service.geocode("Tokyo");
        result.cancel(true);

        assertTrue(pending.isCancelled());
        assertThrows(CancellationException.class, result::join);
        verify(next, never()).geocode(anyString());
        assertFalse(cache.exists(keyDeriver.forGeocode("Tokyo")).join());
    }

    @Test
    @DisplayName("健康检查：每个供应商恰好一项，按注册顺序，异常视为不健康")
    void testProvidersHealth() {
        LocationProvider healthy = provider("Healthy", true, null);
        LocationProvider failing = provider("Failing", true, null);
        LocationProvider throwing = provider("Throwing", true, null);
        LocationProvider down = provider("Down", true, null);
        when(healthy.isHealthy()).thenReturn(CompletableFuture.completedFuture(true));
        when(failing.isHealthy()).thenReturn(CompletableFuture.failedFuture(new ProviderException("Failing", "503")));
        when(throwing.isHealthy()).thenThrow(new IllegalStateException("boom"));
        when(down.isHealthy()).thenReturn(CompletableFuture.completedFuture(false));
        LocationAggregationService service = service(healthy, failing, throwing, down);

        Map<String, Boolean> health = service.getProvidersHealth().join();

        assertEquals(List.of("Healthy", "Failing", "Throwing", "Down"), List.copyOf(health.keySet()));
        assertEquals(List.of(true, false, false, false), List.copyOf(health.values()));
    }

    @Test
    @DisplayName("健康检查并发执行")
    void testProvidersHealthConcurrent() {
        LocationProvider first = provider("First", true, null);
        LocationProvider second = provider("Second", true, null);
        CompletableFuture<Boolean> firstProbe = new CompletableFuture<>();
        when(first.isHealthy()).thenReturn(firstProbe);
        when(second.isHealthy()).thenReturn(CompletableFuture.completedFuture(true));
        LocationAggregationService service = service(first, second);

        CompletableFuture<Map<String, Boolean>> health = service.getProvidersHealth();

        // 第一个探测未完成时第二个已经发出
        verify(second).isHealthy();
        assertFalse(health.isDone());
        firstProbe.complete(true);
        assertEquals(Map.of("First", true, "Second", true), health.join());
    }

    @Test
    @DisplayName("空参数属于调用错误")
    void testNullArguments() {
        LocationAggregationService service = service();

        assertThrows(NullPointerException.class, () -> service.geocode(null));
        assertThrows(NullPointerException.class, () -> service.route(london, null));
    }

    private LocationAggregationService service(LocationProvider... providers) {
        return new LocationAggregationService(ProviderRegistry.of(providers), cache, keyDeriver, clock, meterRegistry);
    }

    private static LocationProvider provider(String name, boolean allowsCaching, Duration ttl) {
        LocationProvider provider = mock(LocationProvider.class);
        when(provider.name()).thenReturn(name);
        when(provider.allowsCaching()).thenReturn(allowsCaching);
        when(provider.cacheTtl()).thenReturn(Optional.ofNullable(ttl));
        return provider;
    }

    private GeocodeResult geocoded(String address, String provider) {
        return GeocodeResult.builder()
            .address(address)
            .coordinates(london)
            .formattedAddress(address + ", Europe")
            .confidence(0.9)
            .providerName(provider)
            .responseTime(clock.instant())
            .build();
    }
}
