package com.locationhub.cache.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationhub.cache.config.CacheProperties.ProviderSettings;
import com.locationhub.cache.dto.Coordinates;
import com.locationhub.cache.dto.GeocodeResult;
import com.locationhub.cache.dto.RouteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HERE 供应商客户端测试
 */
class HereLocationProviderTest {

    private static final String GEOCODE_RESPONSE = """
        {"items":[{"title":"London, England, United Kingdom",
          "position":{"lat":51.50643,"lng":-0.12719},
          "address":{"countryCode":"GBR","city":"London","state":"England","postalCode":"SW1A 2DX"},
          "scoring":{"queryScore":0.97}}]}
        """;

    private static final String ROUTE_RESPONSE = """
        {"routes":[{"sections":[{"summary":{"length":343512,"duration":18120}}]}]}
        """;

    private final List<URI> requests = new ArrayList<>();
    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
    private ProviderSettings settings;

    private HttpStatus status;
    private String body;

    @BeforeEach
    void setUp() {
        settings = new ProviderSettings();
        settings.setName("here");
        settings.setApiKey("test-key");
        settings.setTimeout(Duration.ofSeconds(2));
        status = HttpStatus.OK;
    }

    @Test
    @DisplayName("地理编码解析首个结果")
    void testGeocode() {
        body = GEOCODE_RESPONSE;

        GeocodeResult result = provider().geocode("London Bridge & Tower").join();

        assertEquals(new Coordinates(51.50643, -0.12719), result.getCoordinates());
        assertEquals("London, England, United Kingdom", result.getFormattedAddress());
        assertEquals("GBR", result.getCountryCode());
        assertEquals("SW1A 2DX", result.getPostalCode());
        assertEquals(0.97, result.getConfidence());
        assertEquals("London Bridge & Tower", result.getAddress());
        assertEquals("HERE", result.getProviderName());
        assertEquals(clock.instant(), result.getResponseTime());

        URI uri = requests.get(0);
        assertEquals("geocode.search.hereapi.com", uri.getHost());
        assertEquals("/v1/geocode", uri.getPath());
        assertTrue(uri.getRawQuery().contains("q=London%20Bridge%20%26%20Tower"));
        assertTrue(uri.getRawQuery().contains("apiKey=test-key"));
    }

    @Test
    @DisplayName("无结果时返回不带坐标的结果")
    void testGeocodeNoItems() {
        body = "{\"items\":[]}";

        GeocodeResult result = provider().geocode("zzzz").join();

        assertNull(result.getCoordinates());
        assertEquals("zzzz", result.getAddress());
    }

    @Test
    @DisplayName("逆地理编码使用 at=lat,lon")
    void testReverseGeocode() {
        body = GEOCODE_RESPONSE;
        Coordinates at = new Coordinates(51.5, -0.12);

        GeocodeResult result = provider().reverseGeocode(at).join();

        assertEquals(at, result.getCoordinates());
        assertEquals("London, England, United Kingdom", result.getFormattedAddress());
        assertEquals("/v1/revgeocode", requests.get(0).getPath());
        assertTrue(requests.get(0).getQuery().contains("at=51.500000,-0.120000"));
    }

    @Test
    @DisplayName("路线请求发往路线服务并解析距离和时长")
    void testRoute() {
        body = ROUTE_RESPONSE;

        RouteResult result = provider().route(new Coordinates(51.5, -0.12), new Coordinates(48.85, 2.35)).join();

        assertEquals(343512, result.getDistanceMeters());
        assertEquals(Duration.ofSeconds(18120), result.getDuration());
        assertEquals("router.hereapi.com", requests.get(0).getHost());
        assertEquals("/v8/routes", requests.get(0).getPath());
        assertTrue(requests.get(0).getQuery().contains("transportMode=car"));
    }

    @Test
    @DisplayName("非 2xx 响应转为 ProviderException")
    void testErrorStatus() {
        status = HttpStatus.UNAUTHORIZED;
        body = "{\"error\":\"Unauthorized\"}";

        CompletionException error = assertThrows(CompletionException.class, () -> provider().geocode("London").join());

        assertInstanceOf(ProviderException.class, error.getCause());
        assertEquals("HERE", ((ProviderException) error.getCause()).getProvider());
    }

    @Test
    @DisplayName("无效 JSON 转为 ProviderException")
    void testInvalidJson() {
        body = "<html>";

        CompletionException error = assertThrows(CompletionException.class, () -> provider().geocode("London").join());

        assertInstanceOf(ProviderException.class, error.getCause());
    }

    @Test
    @DisplayName("可缓存 6 小时")
    void testCachePolicy() {
        HereLocationProvider provider = provider();

        assertTrue(provider.allowsCaching());
        assertEquals(Duration.ofHours(6), provider.cacheTtl().orElseThrow());
    }

    @Test
    @DisplayName("能解析伦敦即为健康")
    void testHealthy() {
        body = GEOCODE_RESPONSE;

        assertTrue(provider().isHealthy().join());
        assertTrue(requests.get(0).getQuery().contains("q=London"));
    }

    @Test
    @DisplayName("配置的地址覆盖默认地址")
    void testBaseUrlOverride() {
        settings.setBaseUrl("http://localhost:9090");
        body = GEOCODE_RESPONSE;

        provider().geocode("London").join();

        assertEquals("localhost", requests.get(0).getHost());
        assertEquals(9090, requests.get(0).getPort());
    }

    private HereLocationProvider provider() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(this::exchange);
        return new HereLocationProvider(builder, new ObjectMapper(), settings, clock);
    }

    private Mono<ClientResponse> exchange(ClientRequest request) {
        requests.add(request.url());
        return Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
    }
}
