package com.locationhub.cache.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationhub.cache.config.CacheProperties.ProviderSettings;
import com.locationhub.cache.dto.GeocodeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * 基于 WebClient 的供应商公共逻辑：请求超时、错误转换、JSON 解析
 */
public abstract class AbstractHttpLocationProvider implements LocationProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpLocationProvider.class);

    /** 健康检查使用的探测地址 */
    static final String HEALTH_PROBE_ADDRESS = "London";

    protected final ObjectMapper objectMapper;
    protected final Clock clock;
    protected final String apiKey;
    private final Duration timeout;

    protected AbstractHttpLocationProvider(ObjectMapper objectMapper, ProviderSettings settings, Clock clock) {
        if (!StringUtils.hasText(settings.getApiKey())) {
            log.warn("No API key configured for provider {}", settings.getName());
        }
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.apiKey = settings.getApiKey() != null ? settings.getApiKey() : "";
        this.timeout = settings.getTimeout();
    }

    /**
     * 地址能解析出坐标即视为健康
     */
    @Override
    public CompletableFuture<Boolean> isHealthy() {
        return geocode(HEALTH_PROBE_ADDRESS).thenApply(result -> result.getCoordinates() != null);
    }

    /**
     * GET 请求并解析为 JsonNode，所有失败统一转为 {@link ProviderException}
     */
    protected Mono<JsonNode> getJson(WebClient client, String operation, Function<UriBuilder, URI> uri) {
        return client.get()
            .uri(uri)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .map(this::readTree)
            .onErrorMap(error -> !(error instanceof ProviderException), error -> translate(operation, error));
    }

    protected GeocodeResult.GeocodeResultBuilder resultBuilder() {
        return GeocodeResult.builder()
            .providerName(name())
            .responseTime(clock.instant());
    }

    /**
     * 缺失或非文本字段返回 null
     */
    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body == null ? "" : body);
        } catch (IOException e) {
            throw new ProviderException(name(), "invalid JSON response", e);
        }
    }

    private ProviderException translate(String operation, Throwable error) {
        if (error instanceof WebClientResponseException responseError) {
            return new ProviderException(name(), operation + " returned " + responseError.getStatusCode(), error);
        }
        if (error instanceof TimeoutException) {
            return new ProviderException(name(), operation + " timed out after " + timeout, error);
        }
        return new ProviderException(name(), operation + " failed: " + error.getMessage(), error);
    }
}
