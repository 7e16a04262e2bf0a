package com.locationhub.cache.provider;

/**
 * 供应商调用失败（网络、非 2xx 响应、响应解析）
 */
public class ProviderException extends RuntimeException {

    private final String provider;

    public ProviderException(String provider, String message) {
        super(provider + ": " + message);
        this.provider = provider;
    }

    public ProviderException(String provider, String message, Throwable cause) {
        super(provider + ": " + message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
