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
 * TomTom 位置服务
 * 条款禁止缓存结果
 */
public class TomTomLocationProvider extends AbstractHttpLocationProvider {

    public static final String NAME = "TomTom";

    static final String DEFAULT_BASE_URL = "https://api.tomtom.com";

    private final WebClient webClient;

    public TomTomLocationProvider(WebClient.Builder webClientBuilder,
                                  ObjectMapper objectMapper,
                                  ProviderSettings settings,
                                  Clock clock) {
        super(objectMapper, settings, clock);
        this.webClient = webClientBuilder.clone()
            .baseUrl(StringUtils.hasText(settings.getBaseUrl()) ? settings.getBaseUrl() : DEFAULT_BASE_URL)
            .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean allowsCaching() {
        return false;
    }

    @Override
    public Optional<Duration> cacheTtl() {
        return Optional.empty();
    }

    @Override
    public CompletableFuture<GeocodeResult> geocode(String address) {
        return getJson(webClient, "geocode", uri -> uri.path("/search/2/geocode/{query}.json")
                .queryParam("key", "{key}")
                .build(address, apiKey))
            .map(root -> parseGeocode(root, address))
            .toFuture();
    }

    @Override
    public CompletableFuture<GeocodeResult> reverseGeocode(Coordinates coordinates) {
        return getJson(webClient, "reverse geocode", uri -> uri.path("/search/2/reverseGeocode/{position}.json")
                .queryParam("key", "{key}")
                .build(coordinates.toQueryValue(), apiKey))
            .map(root -> parseReverse(root, coordinates))
            .toFuture();
    }

    @Override
    public CompletableFuture<RouteResult> route(Coordinates from, Coordinates to) {
        String locations = from.toQueryValue() + ":" + to.toQueryValue();
        return getJson(webClient, "route", uri -> uri.path("/routing/1/calculateRoute/{locations}/json")
                .queryParam("key", "{key}")
                .build(locations, apiKey))
            .map(root -> parseRoute(root, from, to))
            .toFuture();
    }

    GeocodeResult parseGeocode(JsonNode root, String address) {
        JsonNode item = root.path("results").path(0);
        if (item.isMissingNode()) {
            return resultBuilder().address(address).build();
        }
        JsonNode position = item.path("position");
        GeocodeResult.GeocodeResultBuilder builder = fromAddress(item.path("address"))
            .address(address)
            .confidence(item.path("score").asDouble(0.0));
        if (position.has("lat") && position.has("lon")) {
            builder.coordinates(new Coordinates(position.path("lat").asDouble(), position.path("lon").asDouble()));
        }
        return builder.build();
    }

    GeocodeResult parseReverse(JsonNode root, Coordinates coordinates) {
        JsonNode item = root.path("addresses").path(0);
        if (item.isMissingNode()) {
            return resultBuilder().coordinates(coordinates).build();
        }
        JsonNode address = item.path("address");
        return fromAddress(address)
            .coordinates(coordinates)
            .address(text(address, "freeformAddress"))
            .confidence(1.0)
            .build();
    }

    RouteResult parseRoute(JsonNode root, Coordinates from, Coordinates to) {
        JsonNode summary = root.path("routes").path(0).path("summary");
        return RouteResult.builder()
            .origin(from)
            .destination(to)
            .distanceMeters(summary.path("lengthInMeters").asDouble(0.0))
            .duration(Duration.ofSeconds(summary.path("travelTimeInSeconds").asLong(0)))
            .providerName(NAME)
            .responseTime(clock.instant())
            .build();
    }

    private GeocodeResult.GeocodeResultBuilder fromAddress(JsonNode address) {
        return resultBuilder()
            .formattedAddress(text(address, "freeformAddress"))
            .countryCode(text(address, "countryCode"))
            .postalCode(text(address, "postalCode"))
            .city(text(address, "municipality"))
            .state(text(address, "countrySubdivision"));
    }
}
