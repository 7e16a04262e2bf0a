package com.locationhub.cache.util;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * CompletableFuture 辅助方法
 */
public final class FutureSupport {

    private FutureSupport() {
    }

    /**
     * 调用异步方法，同步抛出的异常和 null 返回值都转成失败的 Future
     */
    public static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> call) {
        try {
            CompletableFuture<T> future = call.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Async call returned null future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * 剥掉 CompletionException / ExecutionException 包装
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static boolean isCancellation(Throwable error) {
        return unwrap(error) instanceof CancellationException;
    }

    /**
     * 取消不能被吞掉，其余异常交给调用方处理
     */
    public static void rethrowIfCancelled(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException cancellation) {
            throw cancellation;
        }
    }
}
