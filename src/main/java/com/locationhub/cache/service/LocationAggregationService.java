package com.locationhub.cache.service;

import com.locationhub.cache.dto.Coordinates;
import com.locationhub.cache.dto.GeocodeResult;
import com.locationhub.cache.dto.RouteResult;
import com.locationhub.cache.model.OperationKind;
import com.locationhub.cache.model.ProviderDescriptor;
import com.locationhub.cache.provider.LocationProvider;
import com.locationhub.cache.provider.ProviderOutcome;
import com.locationhub.cache.provider.ProviderRegistry;
import com.locationhub.cache.provider.RegisteredProvider;
import com.locationhub.cache.util.CancellationScope;
import com.locationhub.cache.util.FutureSupport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static com.locationhub.cache.constant.CacheConstants.NO_PROVIDER_NAME;

/**
 * 位置查询编排服务
 * <p>
 * 流程：生成 Key -> 查两级缓存 -> 未命中时按注册表顺序逐个尝试供应商
 * -> 首个可用结果按该供应商的缓存策略写入缓存后返回。
 * 全部失败时返回 "None" 结果，不抛异常。
 */
public class LocationAggregationService implements LocationService {

    private static final Logger log = LoggerFactory.getLogger(LocationAggregationService.class);

    private final ProviderRegistry registry;
    private final TwoTierCacheService cache;
    private final CacheKeyDeriver keyDeriver;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public LocationAggregationService(ProviderRegistry registry,
                                      TwoTierCacheService cache,
                                      CacheKeyDeriver keyDeriver,
                                      Clock clock,
                                      MeterRegistry meterRegistry) {
        this.registry = registry;
        this.cache = cache;
        this.keyDeriver = keyDeriver;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        log.info("Location service initialized with providers: {}", registry.names());
    }

    @Override
    public CompletableFuture<GeocodeResult> geocode(String address) {
        Objects.requireNonNull(address, "address");
        return resolve(new Lookup<>(
            OperationKind.GEOCODE,
            keyDeriver.forGeocode(address),
            address,
            GeocodeResult.class,
            provider -> provider.geocode(address),
            result -> result.getCoordinates() != null,
            () -> GeocodeResult.builder()
                .address(address)
                .providerName(NO_PROVIDER_NAME)
                .responseTime(clock.instant())
                .build()));
    }

    @Override
    public CompletableFuture<GeocodeResult> reverseGeocode(Coordinates coordinates) {
        Objects.requireNonNull(coordinates, "coordinates");
        return resolve(new Lookup<>(
            OperationKind.REVERSE_GEOCODE,
            keyDeriver.forReverseGeocode(coordinates),
            coordinates.toString(),
            GeocodeResult.class,
            provider -> provider.reverseGeocode(coordinates),
            result -> StringUtils.hasText(result.getFormattedAddress()),
            () -> GeocodeResult.builder()
                .coordinates(coordinates)
                .providerName(NO_PROVIDER_NAME)
                .responseTime(clock.instant())
                .build()));
    }

    @Override
    public CompletableFuture<RouteResult> route(Coordinates from, Coordinates to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        return resolve(new Lookup<>(
            OperationKind.ROUTE,
            keyDeriver.forRoute(from, to),
            from + " -> " + to,
            RouteResult.class,
            provider -> provider.route(from, to),
            result -> result.getDistanceMeters() > 0,
            () -> RouteResult.builder()
                .origin(from)
                .destination(to)
                .providerName(NO_PROVIDER_NAME)
                .responseTime(clock.instant())
                .build()));
    }

    /**
     * 并发探测所有供应商，探测失败视为不健康
     */
    @Override
    public CompletableFuture<Map<String, Boolean>> getProvidersHealth() {
        List<RegisteredProvider> providers = registry.providers();
        List<CompletableFuture<Boolean>> calls = new ArrayList<>(providers.size());
        List<CompletableFuture<Boolean>> probes = new ArrayList<>(providers.size());
        for (RegisteredProvider entry : providers) {
            CompletableFuture<Boolean> call = FutureSupport.invoke(() -> entry.provider().isHealthy());
            calls.add(call);
            probes.add(call.handle((healthy, error) -> {
                if (error != null) {
                    log.warn("Health check failed for provider {}: {}", entry.name(),
                        FutureSupport.unwrap(error).toString());
                    return false;
                }
                return Boolean.TRUE.equals(healthy);
            }));
        }

        CompletableFuture<Map<String, Boolean>> result = CompletableFuture
            .allOf(probes.toArray(new CompletableFuture[0]))
            .thenApply(ignored -> {
                Map<String, Boolean> snapshot = new LinkedHashMap<>();
                for (int i = 0; i < providers.size(); i++) {
                    snapshot.put(providers.get(i).name(), probes.get(i).join());
                }
                return Collections.unmodifiableMap(snapshot);
            });
        result.whenComplete((snapshot, error) -> {
            if (result.isCancelled()) {
                calls.forEach(call -> call.cancel(true));
            }
        });
        return result;
    }

    private <R> CompletableFuture<R> resolve(Lookup<R> lookup) {
        Timer.Sample sample = Timer.start(meterRegistry);
        CancellationScope<R> scope = new CancellationScope<>();

        scope.track(cache.get(lookup.cacheKey(), lookup.type())).whenComplete((cached, error) -> {
            if (error != null) {
                scope.fail(error);
                return;
            }
            if (cached.isPresent()) {
                log.debug("Cache hit for {}: {}", lookup.kind().prefix(), lookup.subject());
                scope.complete(cached.get());
                return;
            }
            attempt(scope, lookup, 0);
        });

        CompletableFuture<R> result = scope.result();
        result.whenComplete((value, error) -> sample.stop(Timer.builder("location.request.latency")
            .tag("operation", lookup.kind().prefix())
            .register(meterRegistry)));
        return result;
    }

    /**
     * 依次尝试第 index 个供应商，上一个结束后才开始下一个
     */
    private <R> void attempt(CancellationScope<R> scope, Lookup<R> lookup, int index) {
        if (scope.isDone()) {
            return;
        }
        List<RegisteredProvider> providers = registry.providers();
        if (index >= providers.size()) {
            exhausted(scope, lookup);
            return;
        }

        RegisteredProvider candidate = providers.get(index);
        log.debug("Trying provider {} for {}: {}", candidate.name(), lookup.kind().prefix(), lookup.subject());
        scope.track(FutureSupport.invoke(() -> lookup.call().apply(candidate.provider())))
            .handle((value, error) -> ProviderOutcome.of(value, error, lookup.usable()))
            .thenAccept(outcome -> onOutcome(scope, lookup, index, candidate, outcome))
            .exceptionally(error -> {
                scope.fail(error);
                return null;
            });
    }

    private <R> void onOutcome(CancellationScope<R> scope,
                               Lookup<R> lookup,
                               int index,
                               RegisteredProvider candidate,
                               ProviderOutcome<R> outcome) {
        if (outcome.isCancelled() && scope.isDone()) {
            return;
        }
        recordAttempt(candidate, lookup.kind(), outcome.status());
        switch (outcome.status()) {
            case SUCCESS -> {
                ProviderDescriptor descriptor = candidate.descriptor();
                if (!descriptor.allowsCaching()) {
                    log.debug("Provider {} does not allow caching, skip cache write", candidate.name());
                    scope.complete(outcome.value());
                    return;
                }
                scope.track(FutureSupport.invoke(() -> cache.set(lookup.cacheKey(), outcome.value(), descriptor.cacheTtl())))
                    .whenComplete((ignored, error) -> scope.complete(outcome.value()));
            }
            case EMPTY -> {
                log.debug("Provider {} returned no usable {} result for {}",
                    candidate.name(), lookup.kind().prefix(), lookup.subject());
                attempt(scope, lookup, index + 1);
            }
            case FAILED -> {
                log.warn("Provider {} failed for {} {}: {}", candidate.name(), lookup.kind().prefix(),
                    lookup.subject(), outcome.error().toString());
                attempt(scope, lookup, index + 1);
            }
        }
    }

    private <R> void exhausted(CancellationScope<R> scope, Lookup<R> lookup) {
        log.error("All providers failed for {}: {}", lookup.kind().prefix(), lookup.subject());
        Counter.builder("location.provider.exhausted")
            .tag("operation", lookup.kind().prefix())
            .register(meterRegistry)
            .increment();
        scope.complete(lookup.exhausted().get());
    }

    private void recordAttempt(RegisteredProvider candidate, OperationKind kind, ProviderOutcome.Status status) {
        Counter.builder("location.provider.attempts")
            .tag("provider", candidate.name())
            .tag("operation", kind.prefix())
            .tag("outcome", status.name().toLowerCase(Locale.ROOT))
            .register(meterRegistry)
            .increment();
    }

    /**
     * 一次查询所需的全部信息
     */
    private record Lookup<R>(OperationKind kind,
                             String cacheKey,
                             String subject,
                             Class<R> type,
                             Function<LocationProvider, CompletableFuture<R>> call,
                             Predicate<R> usable,
                             Supplier<R> exhausted) {
    }
}
