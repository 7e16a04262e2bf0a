package com.locationhub.cache.constant;

import java.time.Duration;

/**
 * 缓存相关常量
 */
public final class CacheConstants {

    private CacheConstants() {
    }

    /** Key 分隔符 */
    public static final String KEY_SEPARATOR = ":";

    /** 哈希截断长度（十六进制字符数） */
    public static final int KEY_HASH_LENGTH = 16;

    /** 坐标规范化小数位 */
    public static final int COORDINATE_SCALE = 6;

    /** 所有供应商均失败时的供应商名称 */
    public static final String NO_PROVIDER_NAME = "None";

    /** L1 本地缓存 TTL 上限 */
    public static final Duration DEFAULT_LOCAL_CAP = Duration.ofMinutes(5);

    /** L2 默认过期时间 */
    public static final Duration DEFAULT_BACKING_TTL = Duration.ofHours(1);

    /** Redis Key 前缀 */
    public static final String DEFAULT_REDIS_KEY_PREFIX = "location-cache:";

    /** 缓存层标识 */
    public static final String TIER_LOCAL = "l1";
    public static final String TIER_BACKING = "l2";
}
