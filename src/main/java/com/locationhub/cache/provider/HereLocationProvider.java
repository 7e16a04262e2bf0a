package com.locationhub.cache.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationhub.cache.config.CacheProperties.ProviderSettings;
import com.locationhub.cache.dto.Coordinates;
import com.locationhub.cache.dto.GeocodeResult;
import com.locationhub.cache.dto.RouteResult;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * HERE 位置服务
 * 条款允许缓存，缓存 6 小时
 */
public class HereLocationProvider extends AbstractHttpLocationProvider {

    public static final String NAME = "HERE";

    static final String DEFAULT_BASE_URL = "https://geocode.search.hereapi.com";
    static final String DEFAULT_ROUTING_URL = "https://router.hereapi.com";
    private static final Duration CACHE_TTL = Duration.ofHours(6);

    private final WebClient searchClient;
    private final WebClient routingClient;

    public HereLocationProvider(WebClient.Builder webClientBuilder,
                                ObjectMapper objectMapper,
                                ProviderSettings settings,
                                Clock clock) {
        super(objectMapper, settings, clock);
        this.searchClient = webClientBuilder.clone()
            .baseUrl(StringUtils.hasText(settings.getBaseUrl()) ? settings.getBaseUrl() : DEFAULT_BASE_URL)
            .build();
        this.routingClient = webClientBuilder.clone()
            .baseUrl(StringUtils.hasText(settings.getRoutingUrl()) ? settings.getRoutingUrl() : DEFAULT_ROUTING_URL)
            .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean allowsCaching() {
        return true;
    }

    @Override
    public Optional<Duration> cacheTtl() {
        return Optional.of(CACHE_TTL);
    }

    @Override
    public CompletableFuture<GeocodeResult> geocode(String address) {
        return getJson(searchClient, "geocode", uri -> uri.path("/v1/geocode")
                .queryParam("q", "{q}")
                .queryParam("apiKey", "{apiKey}")
                .build(address, apiKey))
            .map(root -> parseGeocode(root, address))
            .toFuture();
    }

    @Override
    public CompletableFuture<GeocodeResult> reverseGeocode(Coordinates coordinates) {
        return getJson(searchClient, "reverse geocode", uri -> uri.path("/v1/revgeocode")
                .queryParam("at", "{at}")
                .queryParam("apiKey", "{apiKey}")
                .build(coordinates.toQueryValue(), apiKey))
            .map(root -> parseReverse(root, coordinates))
            .toFuture();
    }

    @Override
    public CompletableFuture<RouteResult> route(Coordinates from, Coordinates to) {
        return getJson(routingClient, "route", uri -> uri.path("/v8/routes")
                .queryParam("transportMode", "car")
                .queryParam("origin", "{origin}")
                .queryParam("destination", "{destination}")
                .queryParam("return", "summary")
                .queryParam("apiKey", "{apiKey}")
                .build(from.toQueryValue(), to.toQueryValue(), apiKey))
            .map(root -> parseRoute(root, from, to))
            .toFuture();
    }

    GeocodeResult parseGeocode(JsonNode root, String address) {
        JsonNode item = root.path("items").path(0);
        if (item.isMissingNode()) {
            return resultBuilder().address(address).build();
        }
        return fromItem(item)
            .address(address)
            .confidence(item.path("scoring").path("queryScore").asDouble(0.0))
            .build();
    }

    GeocodeResult parseReverse(JsonNode root, Coordinates coordinates) {
        JsonNode item = root.path("items").path(0);
        if (item.isMissingNode()) {
            return resultBuilder().coordinates(coordinates).build();
        }
        return fromItem(item)
            .coordinates(coordinates)
            .address(text(item, "title"))
            .confidence(1.0)
            .build();
    }

    RouteResult parseRoute(JsonNode root, Coordinates from, Coordinates to) {
        JsonNode summary = root.path("routes").path(0).path("sections").path(0).path("summary");
        return RouteResult.builder()
            .origin(from)
            .destination(to)
            .distanceMeters(summary.path("length").asDouble(0.0))
            .duration(Duration.ofSeconds(summary.path("duration").asLong(0)))
            .providerName(NAME)
            .responseTime(clock.instant())
            .build();
    }

    private GeocodeResult.GeocodeResultBuilder fromItem(JsonNode item) {
        JsonNode position = item.path("position");
        JsonNode address = item.path("address");
        GeocodeResult.GeocodeResultBuilder builder = resultBuilder()
            .formattedAddress(text(item, "title"))
            .countryCode(text(address, "countryCode"))
            .postalCode(text(address, "postalCode"))
            .city(text(address, "city"))
            .state(text(address, "state"));
        if (position.has("lat") && position.has("lng")) {
            builder.coordinates(new Coordinates(position.path("lat").asDouble(), position.path("lng").asDouble()));
        }
        return builder;
    }
}
