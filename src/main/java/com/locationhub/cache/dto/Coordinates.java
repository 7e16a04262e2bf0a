package com.locationhub.cache.dto;

import java.util.Locale;

/**
 * 经纬度坐标，范围校验在 HTTP 层完成
 */
public record Coordinates(double latitude, double longitude) {

    /**
     * 供应商请求参数格式：lat,lon
     */
    public String toQueryValue() {
        return String.format(Locale.ROOT, "%.6f,%.6f", latitude, longitude);
    }

    @Override
    public String toString() {
        return latitude + "," + longitude;
    }
}
