package com.locationhub.cache.service;

import com.locationhub.cache.dto.Coordinates;
import com.locationhub.cache.dto.GeocodeResult;
import com.locationhub.cache.dto.RouteResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 位置查询服务
 * <p>
 * 供应商与缓存故障不会以异常形式抛出：所有供应商都失败时返回 providerName 为 "None" 的结果。
 */
public interface LocationService {

    CompletableFuture<GeocodeResult> geocode(String address);

    CompletableFuture<GeocodeResult> reverseGeocode(Coordinates coordinates);

    CompletableFuture<RouteResult> route(Coordinates from, Coordinates to);

    /**
     * 各供应商健康状态，按注册表顺序，每个供应商恰好一项
     */
    CompletableFuture<Map<String, Boolean>> getProvidersHealth();
}
