package com.hao.gateway.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.hao.gateway.common.constants.GatewayHeaders;
import com.hao.gateway.common.constants.RateLimitConstants;
import com.hao.gateway.common.exception.RateLimitException;
import com.hao.gateway.common.limiter.RateLimitDecision;
import com.hao.gateway.common.limiter.RateLimiterRegistry;
import com.hao.gateway.common.model.SearchResponse;
import com.hao.gateway.config.GatewayProperties;
import com.hao.gateway.integration.correlation.CorrelationIdProvider;
import com.hao.gateway.scoring.ReliabilityResult;
import com.hao.gateway.scoring.ReliabilityScorer;
import com.hao.gateway.service.SearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.apache.hc.core5.http.ConnectionRequestTimeoutException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * 搜索协调服务实现
 *
 * 类职责：
 * 作为浏览器与后端搜索服务之间的边界，负责鉴权、限流、校验、重试、超时分类与可信度附加。
 *
 * 核心实现思路：
 * - 仅对 503 与连接类错误重试，每次尝试前按 retry-delays 等待；502 表示后端已内部重试，直接转发。
 * - 读取超时单独识别为 504，不重试。
 * - 后端成功响应解析为 JSON 对象后追加 search_id、progress_url、correlation_id 与 reliability。
 * - 所有已分类失败以 SearchResponse 返回，不向上抛出。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchServiceImpl implements SearchService {

    static final String DEFAULT_SETOR_ID = "vestuario";

    static final String PROGRESS_PATH = "/api/buscar-progress?search_id=";

    private static final String BEARER_PREFIX = "Bearer ";

    private static final int LOG_BODY_PREVIEW = 200;

    private final RestTemplate restTemplate;

    private final GatewayProperties properties;

    private final RateLimiterRegistry rateLimiterRegistry;

    private final CorrelationIdProvider correlationIdProvider;

    private final ReliabilityScorer reliabilityScorer;

    private final ObjectMapper objectMapper;

    private final Clock gatewayClock;

    @Override
    public SearchResponse search(Map<String, Object> request, String authorization, String inboundCorrelationId, String clientKey) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return SearchResponse.message(HttpStatus.UNAUTHORIZED.value(),
                    "Autenticacao necessaria. Faca login para continuar.");
        }

        RateLimitDecision decision = rateLimiterRegistry.get(RateLimitConstants.POLICY_SEARCH).checkAndConsume(clientKey);
        if (!decision.isAllowed()) {
            log.warn("搜索限流拦截|Search_rate_limited,client={},retryAfter={}s", clientKey, decision.getRetryAfterSeconds());
            throw new RateLimitException("Limite de buscas atingido. Aguarde um momento.", decision.getRetryAfterSeconds());
        }

        Map<String, Object> payload = request == null ? new LinkedHashMap<>() : new LinkedHashMap<>(request);
        if (!hasElements(payload.get("ufs"))) {
            return SearchResponse.message(HttpStatus.BAD_REQUEST.value(), "Selecione pelo menos um estado");
        }
        if (isBlank(payload.get("data_inicial")) || isBlank(payload.get("data_final"))) {
            return SearchResponse.message(HttpStatus.BAD_REQUEST.value(), "Período obrigatório");
        }

        GatewayProperties.Backend backend = properties.getBackend();
        if (!backend.isConfigured()) {
            log.error("后端地址未配置|Backend_url_not_configured");
            return SearchResponse.message(HttpStatus.SERVICE_UNAVAILABLE.value(),
                    "Servidor nao configurado. Contate o suporte.");
        }

        String searchId = isBlank(payload.get("search_id")) ? UUID.randomUUID().toString() : payload.get("search_id").toString();
        payload.put("search_id", searchId);
        if (isBlank(payload.get("setor_id"))) {
            payload.put("setor_id", DEFAULT_SETOR_ID);
        }
        String correlationId = correlationIdProvider.resolveForOutbound(inboundCorrelationId);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.AUTHORIZATION, authorization);
        headers.set(GatewayHeaders.CORRELATION_ID, correlationId);
        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(payload, headers);

        String url = stripTrailingSlash(backend.getUrl()) + "/buscar";
        Stopwatch stopwatch = Stopwatch.createStarted();
        SearchResponse result = execute(url, entity, backend, searchId, correlationId);
        log.info("搜索请求结束|Search_finished,searchId={},status={},elapsedMs={}",
                searchId, result.getStatus(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return result;
    }

    private SearchResponse execute(String url, HttpEntity<Map<String, Object>> entity, GatewayProperties.Backend backend,
                                   String searchId, String correlationId) {
        int maxAttempts = Math.max(1, backend.getMaxAttempts());
        ResponseEntity<String> lastResponse = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                Duration delay = delayBefore(backend.getRetryDelays(), attempt);
                log.warn("重试后端搜索|Search_retry,searchId={},attempt={}/{},delayMs={}",
                        searchId, attempt, maxAttempts - 1, delay.toMillis());
                if (!pause(delay)) {
                    return SearchResponse.message(HttpStatus.SERVICE_UNAVAILABLE.value(),
                            "Backend indisponível após múltiplas tentativas");
                }
            }

            try {
                lastResponse = restTemplate.exchange(url, HttpMethod.POST, entity, String.class);
            } catch (ResourceAccessException e) {
                if (isReadTimeout(e)) {
                    log.error("后端搜索超时|Search_timeout,searchId={},timeout={}", searchId, backend.getSearchTimeout());
                    return SearchResponse.message(HttpStatus.GATEWAY_TIMEOUT.value(), timeoutMessage(backend.getSearchTimeout()));
                }
                String reason = e.getMostSpecificCause().getMessage();
                if (attempt >= maxAttempts - 1) {
                    log.error("后端不可用|Backend_unavailable,searchId={},url={},reason={}", searchId, url, reason, e);
                    return SearchResponse.message(HttpStatus.SERVICE_UNAVAILABLE.value(),
                            "Backend indisponível em " + backend.getUrl() + ": " + (reason != null ? reason : "conexão recusada"));
                }
                log.warn("后端连接失败_准备重试|Backend_connect_failed_will_retry,searchId={},attempt={},reason={}",
                        searchId, attempt + 1, reason);
                continue;
            }

            int status = lastResponse.getStatusCode().value();
            if (lastResponse.getStatusCode().is2xxSuccessful() || !backend.getRetryableStatuses().contains(status)) {
                break;
            }
            log.warn("后端返回可重试状态|Backend_retryable_status,searchId={},status={},detail={},{}",
                    searchId, status, extractDetail(lastResponse.getBody()),
                    attempt < maxAttempts - 1 ? "will_retry" : "no_more_retries");
        }

        if (lastResponse == null) {
            return SearchResponse.message(HttpStatus.SERVICE_UNAVAILABLE.value(), "Backend indisponível após múltiplas tentativas");
        }
        if (!lastResponse.getStatusCode().is2xxSuccessful()) {
            String detail = extractDetail(lastResponse.getBody());
            return SearchResponse.message(lastResponse.getStatusCode().value(), detail != null ? detail : "Erro no backend");
        }

        Map<String, Object> data = parseObject(lastResponse.getBody());
        if (data == null) {
            log.error("后端返回非JSON|Backend_non_json_response,searchId={},preview={}",
                    searchId, preview(lastResponse.getBody()));
            return SearchResponse.message(HttpStatus.BAD_GATEWAY.value(), "Resposta inesperada do servidor. Tente novamente.");
        }

        Map<String, Object> body = new LinkedHashMap<>(data);
        body.put("search_id", searchId);
        body.put("progress_url", PROGRESS_PATH + URLEncoder.encode(searchId, StandardCharsets.UTF_8));
        body.put("correlation_id", correlationId);
        body.put("reliability", assessReliability(data));
        return SearchResponse.of(HttpStatus.OK.value(), body);
    }

    /**
     * 根据后端返回的元数据计算可信度，元数据不足时给出兜底结果
     */
    ReliabilityResult assessReliability(Map<String, Object> data) {
        String method = reliabilityScorer.deriveMethod(asString(data.get("response_state")), asString(data.get("cache_status")));
        Long freshness = deriveFreshnessMinutes(data, method);
        Object coverage = data.get("coverage_pct");
        if (!(coverage instanceof Number) || freshness == null) {
            return reliabilityScorer.unavailable(freshness, method);
        }
        return reliabilityScorer.calculateReliability(((Number) coverage).doubleValue(), freshness, method);
    }

    private Long deriveFreshnessMinutes(Map<String, Object> data, String method) {
        Object explicit = data.get("freshness_minutes");
        if (explicit instanceof Number) {
            return Math.max(0L, ((Number) explicit).longValue());
        }
        if ("cached".equals(asString(data.get("response_state")))) {
            Instant cachedAt = parseInstant(asString(data.get("cached_at")));
            if (cachedAt == null) {
                return null;
            }
            return Math.max(0L, Duration.between(cachedAt, gatewayClock.instant()).toMinutes());
        }
        return "live".equals(method) ? 0L : null;
    }

    private Instant parseInstant(String value) {
        if (Strings.isNullOrEmpty(value)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                // 不带时区的时间戳按 UTC 处理
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                log.debug("缓存时间无法解析|Cached_at_unparseable,value={}", value);
                return null;
            }
        }
    }

    private Map<String, Object> parseObject(String raw) {
        if (Strings.isNullOrEmpty(raw)) {
            return null;
        }
        try {
            return objectMapper.readValue(raw, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private String extractDetail(String raw) {
        Map<String, Object> parsed = parseObject(raw);
        if (parsed == null) {
            return null;
        }
        Object detail = parsed.get("detail");
        return detail == null ? null : detail.toString();
    }

    private boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("重试等待被中断|Retry_wait_interrupted");
            return false;
        }
    }

    private static Duration delayBefore(List<Duration> delays, int attempt) {
        if (delays == null || delays.isEmpty()) {
            return Duration.ZERO;
        }
        return delays.get(Math.min(attempt, delays.size() - 1));
    }

    /**
     * 仅响应读取超时算作搜索超时
     *
     * HttpClient 5 的 ConnectTimeoutException 也是 SocketTimeoutException 的子类，
     * 建连超时、连接池等待超时属于后端不可达，需先排除，走重试后返回 503 的分支。
     */
    static boolean isReadTimeout(ResourceAccessException e) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof ConnectTimeoutException || cause instanceof ConnectException
                    || cause instanceof ConnectionRequestTimeoutException) {
                return false;
            }
            if (cause instanceof SocketTimeoutException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String timeoutMessage(Duration timeout) {
        return "A consulta excedeu o tempo limite (" + timeout.toMinutes()
                + " min). Tente com menos estados ou um período menor.";
    }

    private static boolean hasElements(Object value) {
        return value instanceof Collection && !((Collection<?>) value).isEmpty();
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().trim().isEmpty();
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String preview(String raw) {
        return raw == null ? "" : raw.substring(0, Math.min(raw.length(), LOG_BODY_PREVIEW));
    }
}
