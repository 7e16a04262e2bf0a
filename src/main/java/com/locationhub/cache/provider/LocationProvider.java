package com.locationhub.cache.provider;

import com.locationhub.cache.dto.Coordinates;
import com.locationhub.cache.dto.GeocodeResult;
import com.locationhub.cache.dto.RouteResult;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 外部位置供应商
 * <p>
 * 查询方法可以返回"空"结果（geocode 无坐标、逆地理编码无格式化地址、路线距离为 0），
 * 也可以以 {@link ProviderException} 失败。两者都会触发降级到下一个供应商。
 */
public interface LocationProvider {

    String name();

    /**
     * 供应商条款是否允许缓存其结果
     */
    boolean allowsCaching();

    /**
     * 偏好的缓存时间，为空时使用 L2 默认值
     */
    Optional<Duration> cacheTtl();

    CompletableFuture<GeocodeResult> geocode(String address);

    CompletableFuture<GeocodeResult> reverseGeocode(Coordinates coordinates);

    CompletableFuture<RouteResult> route(Coordinates from, Coordinates to);

    CompletableFuture<Boolean> isHealthy();
}
