package com.locationhub.cache.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 单次异步请求的取消作用域
 * <p>
 * 记录当前正在执行的一步（缓存 I/O 或供应商调用），
 * 结果 Future 被取消时一并取消这一步，之后的步骤通过 {@link #isDone()} 判断不再启动。
 */
public final class CancellationScope<T> {

    private final CompletableFuture<T> result = new CompletableFuture<>();
    private final AtomicReference<Future<?>> inFlight = new AtomicReference<>();

    public CancellationScope() {
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                Future<?> current = inFlight.getAndSet(null);
                if (current != null) {
                    current.cancel(true);
                }
            }
        });
    }

    /**
     * 登记当前步骤；作用域已取消时立即取消该步骤
     */
    public <S> CompletableFuture<S> track(CompletableFuture<S> step) {
        inFlight.set(step);
        if (result.isCancelled()) {
            step.cancel(true);
        }
        return step;
    }

    public boolean isDone() {
        return result.isDone();
    }

    public void complete(T value) {
        inFlight.set(null);
        result.complete(value);
    }

    public void fail(Throwable error) {
        inFlight.set(null);
        result.completeExceptionally(FutureSupport.unwrap(error));
    }

    public CompletableFuture<T> result() {
        return result;
    }
}
