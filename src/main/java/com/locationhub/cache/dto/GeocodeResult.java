package com.locationhub.cache.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * 地理编码 / 逆地理编码结果
 * coordinates 为空表示该结果不可用
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GeocodeResult {

    /** 查询的地址文本 */
    String address;

    Coordinates coordinates;

    /** 供应商给出的置信度 */
    double confidence;

    String formattedAddress;

    String countryCode;

    String postalCode;

    String city;

    String state;

    /** 提供结果的供应商，"None" 表示全部失败 */
    String providerName;

    Instant responseTime;
}
