package com.locationhub.cache.model;

/**
 * 位置查询操作类型，前缀用于缓存 Key
 */
public enum OperationKind {

    GEOCODE("geocode"),
    REVERSE_GEOCODE("reverse"),
    ROUTE("route");

    private final String prefix;

    OperationKind(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
