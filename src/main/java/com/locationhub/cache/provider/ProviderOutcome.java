package com.locationhub.cache.provider;

import com.locationhub.cache.util.FutureSupport;

import java.util.function.Predicate;

/**
 * 单次供应商尝试的结果
 *
 * @param status 成功 / 空结果 / 失败
 * @param value  成功时的结果
 * @param error  失败原因
 */
public record ProviderOutcome<R>(Status status, R value, Throwable error) {

    public enum Status {
        SUCCESS,
        EMPTY,
        FAILED
    }

    public static <R> ProviderOutcome<R> success(R value) {
        return new ProviderOutcome<>(Status.SUCCESS, value, null);
    }

    public static <R> ProviderOutcome<R> empty() {
        return new ProviderOutcome<>(Status.EMPTY, null, null);
    }

    public static <R> ProviderOutcome<R> failed(Throwable error) {
        return new ProviderOutcome<>(Status.FAILED, null, FutureSupport.unwrap(error));
    }

    /**
     * 根据调用结果和可用性判断归类
     */
    public static <R> ProviderOutcome<R> of(R value, Throwable error, Predicate<R> usable) {
        if (error != null) {
            return failed(error);
        }
        if (value == null) {
            return empty();
        }
        try {
            return usable.test(value) ? success(value) : empty();
        } catch (RuntimeException e) {
            return failed(e);
        }
    }

    public boolean isCancelled() {
        return status == Status.FAILED && FutureSupport.isCancellation(error);
    }
}
