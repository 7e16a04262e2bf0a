package com.locationhub.cache.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 路线规划结果，distanceMeters 大于 0 才视为可用
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RouteResult {

    Coordinates origin;

    Coordinates destination;

    double distanceMeters;

    @Builder.Default
    Duration duration = Duration.ZERO;

    @Builder.Default
    List<Coordinates> routePoints = List.of();

    @Builder.Default
    List<String> instructions = List.of();

    String providerName;

    Instant responseTime;
}
