package com.locationhub.cache.controller;

import com.locationhub.cache.constant.CacheConstants;
import com.locationhub.cache.dto.ApiResponse;
import com.locationhub.cache.dto.Coordinates;
import com.locationhub.cache.dto.GeocodeResult;
import com.locationhub.cache.dto.RouteResult;
import com.locationhub.cache.service.LocationService;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 位置查询 API
 * 结果不可用（全部供应商失败）时返回 404
 */
@Slf4j
@RestController
@RequestMapping("/api/location")
@RequiredArgsConstructor
public class LocationController {

    private final LocationService locationService;

    /**
     * 地理编码：地址 -> 坐标
     */
    @GetMapping("/geocode")
    public CompletableFuture<ResponseEntity<ApiResponse<GeocodeResult>>> geocode(
            @RequestParam @NotBlank String address) {
        return locationService.geocode(address)
            .thenApply(result -> result.getCoordinates() != null && isServed(result.getProviderName())
                ? ResponseEntity.ok(ApiResponse.success(result, result.getProviderName()))
                : notFound("无法解析地址: " + address));
    }

    /**
     * 逆地理编码：坐标 -> 地址
     */
    @GetMapping("/reverse-geocode")
    public CompletableFuture<ResponseEntity<ApiResponse<GeocodeResult>>> reverseGeocode(
            @RequestParam @DecimalMin("-90.0") @DecimalMax("90.0") double latitude,
            @RequestParam @DecimalMin("-180.0") @DecimalMax("180.0") double longitude) {
        Coordinates coordinates = new Coordinates(latitude, longitude);
        return locationService.reverseGeocode(coordinates)
            .thenApply(result -> StringUtils.hasText(result.getFormattedAddress()) && isServed(result.getProviderName())
                ? ResponseEntity.ok(ApiResponse.success(result, result.getProviderName()))
                : notFound("无法解析坐标: " + coordinates));
    }

    /**
     * 路线规划
     */
    @GetMapping("/route")
    public CompletableFuture<ResponseEntity<ApiResponse<RouteResult>>> route(
            @RequestParam @DecimalMin("-90.0") @DecimalMax("90.0") double fromLat,
            @RequestParam @DecimalMin("-180.0") @DecimalMax("180.0") double fromLon,
            @RequestParam @DecimalMin("-90.0") @DecimalMax("90.0") double toLat,
            @RequestParam @DecimalMin("-180.0") @DecimalMax("180.0") double toLon) {
        Coordinates from = new Coordinates(fromLat, fromLon);
        Coordinates to = new Coordinates(toLat, toLon);
        return locationService.route(from, to)
            .thenApply(result -> result.getDistanceMeters() > 0 && isServed(result.getProviderName())
                ? ResponseEntity.ok(ApiResponse.success(result, result.getProviderName()))
                : notFound("无法规划路线: " + from + " -> " + to));
    }

    /**
     * 供应商健康状态
     */
    @GetMapping("/health")
    public CompletableFuture<ApiResponse<Map<String, Boolean>>> health() {
        return locationService.getProvidersHealth().thenApply(ApiResponse::success);
    }

    private static boolean isServed(String providerName) {
        return !CacheConstants.NO_PROVIDER_NAME.equals(providerName);
    }

    private static <T> ResponseEntity<ApiResponse<T>> notFound(String message) {
        log.info("Location lookup returned no result: {}", message);
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound(message));
    }
}
