package com.hao.gateway.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.hao.gateway.common.constants.GatewayHeaders;
import com.hao.gateway.config.GatewayProperties;
import com.hao.gateway.integration.upstream.UpstreamConnectException;
import com.hao.gateway.integration.upstream.UpstreamConnection;
import com.hao.gateway.integration.upstream.UpstreamStreamClient;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.apache.hc.core5.http.ConnectionRequestTimeoutException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URLEncoder;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * SSE 进度流中继
 *
 * 类职责：
 * 为每个 search_id 把后端的事件流原样转发给唯一的客户端连接，并负责流的生命周期与失败分类。
 *
 * 状态机：
 * Pending -> Connecting -> Streaming -> {Completed, ClientDisconnected, UpstreamTimeout, UpstreamError}
 *
 * 核心实现思路：
 * - 分两阶段：{@link #connect} 在请求线程上完成建连与状态码判定，此时响应尚未提交，
 *   失败可以用独立的 HTTP 状态返回；{@link #forward} 在中继线程上逐块转发。
 * - 客户端取消信号触发时立即中断上游（协作式取消），阻塞中的读取随即返回。
 * - 看门狗按固定频率检查上游静默时长，超过阈值即中断上游并归类为超时。
 * - 进入转发阶段后状态行已提交，超时与错误改为写出最后一个 "event: error" 帧。
 * - 所有退出路径都经过 {@link StreamSession#release()}，恰好释放一次。
 */
@Slf4j
public class StreamingRelay {

    private static final int ERROR_DETAIL_LIMIT = 512;

    private final GatewayProperties properties;

    private final UpstreamStreamClient upstreamClient;

    private final ScheduledExecutorService watchdogExecutor;

    private final ObjectMapper objectMapper;

    private final Ticker ticker;

    public StreamingRelay(GatewayProperties properties, UpstreamStreamClient upstreamClient,
                          ScheduledExecutorService watchdogExecutor, ObjectMapper objectMapper) {
        this(properties, upstreamClient, watchdogExecutor, objectMapper, Ticker.systemTicker());
    }

    StreamingRelay(GatewayProperties properties, UpstreamStreamClient upstreamClient,
                   ScheduledExecutorService watchdogExecutor, ObjectMapper objectMapper, Ticker ticker) {
        this.properties = properties;
        this.upstreamClient = upstreamClient;
        this.watchdogExecutor = watchdogExecutor;
        this.objectMapper = objectMapper;
        this.ticker = ticker;
    }

    /**
     * 建连阶段
     *
     * 实现逻辑：
     * 1. 校验 search_id 与后端配置，缺失时不发起任何上游请求。
     * 2. 以事件流类型发起上游请求，转发凭证与关联 ID。
     * 3. 按异常类型与状态码分类失败；成功时返回会话并挂接取消信号。
     *
     * @param request 进度流请求
     * @param signal 客户端取消信号
     * @return 可转发的会话，或终止结果
     */
    public RelayHandshake connect(StreamRequest request, CancellationSignal signal) {
        Stopwatch stopwatch = Stopwatch.createStarted(ticker);
        String searchId = request.getSearchId();

        if (!StringUtils.hasText(searchId)) {
            log.warn("缺少search_id_拒绝中继|Relay_rejected_missing_search_id");
            return RelayHandshake.terminated(RelayOutcome.rejected(400, "Missing search_id", null));
        }
        if (!properties.getBackend().isConfigured()) {
            log.error("后端地址未配置_拒绝中继|Relay_rejected_backend_not_configured,searchId={}", searchId);
            return RelayHandshake.terminated(RelayOutcome.rejected(503, "Backend not configured", searchId));
        }

        String url = progressUrl(searchId);
        UpstreamConnection connection;
        try {
            connection = upstreamClient.open(url, upstreamHeaders(request));
        } catch (IOException e) {
            RelayOutcome outcome = classifyConnectFailure(e, signal, searchId, elapsed(stopwatch));
            logOutcome(outcome, e);
            return RelayHandshake.terminated(outcome);
        }

        if (signal.isCancelled()) {
            closeQuietly(connection, searchId);
            RelayOutcome outcome = RelayOutcome.clientDisconnected(searchId, elapsed(stopwatch), 0);
            logOutcome(outcome, null);
            return RelayHandshake.terminated(outcome);
        }

        int status = connection.status();
        if (status < 200 || status >= 300) {
            String detail = readErrorDetail(connection, status);
            closeQuietly(connection, searchId);
            RelayOutcome outcome = RelayOutcome.upstreamError(status, RelayErrorType.UPSTREAM_STATUS,
                    detail, searchId, elapsed(stopwatch), 0);
            logOutcome(outcome, null);
            return RelayHandshake.terminated(outcome);
        }

        InputStream body;
        try {
            body = connection.body();
        } catch (IOException e) {
            closeQuietly(connection, searchId);
            RelayOutcome outcome = RelayOutcome.timeout(RelayErrorType.TERMINATED,
                    describe(e), searchId, elapsed(stopwatch), 0);
            logOutcome(outcome, e);
            return RelayHandshake.terminated(outcome);
        }
        if (body == null) {
            closeQuietly(connection, searchId);
            RelayOutcome outcome = RelayOutcome.upstreamError(502, RelayErrorType.EMPTY_BODY,
                    "Upstream returned no body", searchId, elapsed(stopwatch), 0);
            logOutcome(outcome, null);
            return RelayHandshake.terminated(outcome);
        }

        StreamSession session = new StreamSession(searchId, signal, connection, ticker, stopwatch);
        signal.onCancel(() -> session.abortUpstream("client_disconnected"));
        log.info("上游进度流已建立|Upstream_stream_opened,searchId={},status={},elapsedMs={}",
                searchId, status, session.elapsedMs());
        return RelayHandshake.streaming(session);
    }

    /**
     * 转发阶段
     *
     * 实现逻辑：
     * 1. 启动空闲看门狗。
     * 2. 循环读取上游可用字节并立即写给客户端，不做额外缓冲。
     * 3. 读取失败时依据取消信号、看门狗标记与异常类型分类。
     * 4. 释放上游连接后，按结果写出错误帧并结束客户端响应。
     *
     * @param session 建连阶段返回的会话
     * @param sink 客户端写出端
     * @return 终止结果
     */
    public RelayOutcome forward(StreamSession session, ClientSink sink) {
        String searchId = session.getSearchId();
        RelayOutcome outcome;
        try {
            startWatchdog(session);
            outcome = pump(session, sink);
        } catch (RuntimeException e) {
            log.error("中继转发异常|Relay_forward_error,searchId={}", searchId, e);
            outcome = RelayOutcome.upstreamError(502, RelayErrorType.RELAY_FAILURE, describe(e),
                    searchId, session.elapsedMs(), session.bytesRelayed());
        } finally {
            session.release();
        }

        logOutcome(outcome, null);
        if (outcome.getTermination() != RelayTermination.CLIENT_DISCONNECTED) {
            if (outcome.isStructured()) {
                writeErrorFrame(outcome, sink);
            }
            sink.complete();
        }
        return outcome;
    }

    /**
     * 放弃一个已建立但无法进入转发阶段的会话
     */
    public void abandon(StreamSession session) {
        session.release();
    }

    private RelayOutcome pump(StreamSession session, ClientSink sink) {
        String searchId = session.getSearchId();
        byte[] buffer = new byte[Math.max(256, properties.getRelay().getChunkSize())];
        InputStream in;
        try {
            in = session.body();
        } catch (IOException e) {
            return classifyReadFailure(session, e);
        }

        while (true) {
            if (session.isClientCancelled()) {
                return RelayOutcome.clientDisconnected(searchId, session.elapsedMs(), session.bytesRelayed());
            }

            int read;
            try {
                read = in.read(buffer);
            } catch (IOException e) {
                return classifyReadFailure(session, e);
            }
            if (read < 0) {
                if (session.isClientCancelled()) {
                    return RelayOutcome.clientDisconnected(searchId, session.elapsedMs(), session.bytesRelayed());
                }
                if (session.isIdleExpired()) {
                    return idleTimeout(session);
                }
                return RelayOutcome.completed(searchId, session.elapsedMs(), session.bytesRelayed());
            }
            if (read == 0) {
                continue;
            }

            session.touch(read);
            if (session.isClientCancelled()) {
                return RelayOutcome.clientDisconnected(searchId, session.elapsedMs(), session.bytesRelayed());
            }
            try {
                sink.write(buffer, 0, read);
            } catch (IOException e) {
                log.debug("写出客户端失败_视为断开|Client_write_failed,searchId={},message={}", searchId, e.getMessage());
                session.getSignal().cancel("write_failed");
                return RelayOutcome.clientDisconnected(searchId, session.elapsedMs(), session.bytesRelayed());
            }
        }
    }

    private RelayOutcome classifyReadFailure(StreamSession session, IOException e) {
        String searchId = session.getSearchId();
        if (session.isClientCancelled()) {
            return RelayOutcome.clientDisconnected(searchId, session.elapsedMs(), session.bytesRelayed());
        }
        if (session.isIdleExpired() || e instanceof SocketTimeoutException) {
            return idleTimeout(session);
        }
        return RelayOutcome.timeout(RelayErrorType.TERMINATED, describe(e), searchId,
                session.elapsedMs(), session.bytesRelayed());
    }

    private RelayOutcome idleTimeout(StreamSession session) {
        Duration idle = properties.getRelay().getIdleTimeout();
        return RelayOutcome.timeout(RelayErrorType.IDLE_TIMEOUT,
                "No data from backend for " + idle.toMillis() + " ms",
                session.getSearchId(), session.elapsedMs(), session.bytesRelayed());
    }

    /**
     * 建连失败分类
     *
     * 499 只由取消信号决定。连接池等待超时、线程中断等同属 InterruptedIOException，
     * 但都是服务端一侧的问题，不能算作客户端离开。
     */
    private RelayOutcome classifyConnectFailure(IOException e, CancellationSignal signal, String searchId, long elapsedMs) {
        if (signal.isCancelled()) {
            return RelayOutcome.clientDisconnected(searchId, elapsedMs, 0);
        }
        if (e instanceof UpstreamConnectException || e instanceof ConnectTimeoutException
                || e instanceof ConnectException || e instanceof UnknownHostException) {
            return RelayOutcome.upstreamError(502, null, "Failed to connect to backend", searchId, elapsedMs, 0);
        }
        if (e instanceof ConnectionRequestTimeoutException) {
            return RelayOutcome.upstreamError(503, null, "Backend connection pool exhausted", searchId, elapsedMs, 0);
        }
        if (e instanceof SocketTimeoutException) {
            return RelayOutcome.timeout(RelayErrorType.IDLE_TIMEOUT, describe(e), searchId, elapsedMs, 0);
        }
        return RelayOutcome.timeout(RelayErrorType.TERMINATED, describe(e), searchId, elapsedMs, 0);
    }

    private void startWatchdog(StreamSession session) {
        long idleNanos = properties.getRelay().getIdleTimeout().toNanos();
        long periodMillis = Math.max(50, TimeUnit.NANOSECONDS.toMillis(idleNanos) / 4);
        ScheduledFuture<?> future = watchdogExecutor.scheduleAtFixedRate(() -> {
            if (session.idleNanos() > idleNanos) {
                log.warn("上游静默超时|Upstream_idle_timeout,searchId={},idleMs={}",
                        session.getSearchId(), TimeUnit.NANOSECONDS.toMillis(session.idleNanos()));
                session.expireIdle();
            }
        }, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        session.attachWatchdog(future);
    }

    private void writeErrorFrame(RelayOutcome outcome, ClientSink sink) {
        try {
            String json = objectMapper.writeValueAsString(outcome.toErrorBody());
            byte[] frame = ("event: error\ndata: " + json + "\n\n").getBytes(StandardCharsets.UTF_8);
            sink.write(frame, 0, frame.length);
        } catch (JsonProcessingException e) {
            log.error("错误帧序列化失败|Error_frame_serialize_failed,searchId={}", outcome.getSearchId(), e);
        } catch (IOException e) {
            log.debug("错误帧写出失败_客户端已断开|Error_frame_write_failed,searchId={}", outcome.getSearchId());
        }
    }

    private Map<String, String> upstreamHeaders(StreamRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeaders.ACCEPT, MediaType.TEXT_EVENT_STREAM_VALUE);
        headers.put(HttpHeaders.CACHE_CONTROL, "no-cache");
        if (StringUtils.hasText(request.getToken())) {
            headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + request.getToken());
        }
        if (StringUtils.hasText(request.getCorrelationId())) {
            headers.put(GatewayHeaders.CORRELATION_ID, request.getCorrelationId());
        }
        return headers;
    }

    private String progressUrl(String searchId) {
        String base = properties.getBackend().getUrl().trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/buscar-progress/" + URLEncoder.encode(searchId, StandardCharsets.UTF_8);
    }

    private String readErrorDetail(UpstreamConnection connection, int status) {
        try {
            InputStream body = connection.body();
            if (body != null) {
                byte[] bytes = body.readNBytes(ERROR_DETAIL_LIMIT);
                if (bytes.length > 0) {
                    return new String(bytes, StandardCharsets.UTF_8);
                }
            }
        } catch (IOException e) {
            log.debug("读取上游错误正文失败|Upstream_error_body_unreadable,status={},message={}", status, e.getMessage());
        }
        return "Backend responded with status " + status;
    }

    private void closeQuietly(UpstreamConnection connection, String searchId) {
        try {
            connection.close();
        } catch (IOException e) {
            log.warn("关闭上游连接异常|Upstream_close_error,searchId={},message={}", searchId, e.getMessage());
        }
    }

    private void logOutcome(RelayOutcome outcome, Throwable cause) {
        switch (outcome.getTermination()) {
            case COMPLETED:
                log.info("进度流正常结束|Relay_completed,searchId={},elapsedMs={},bytes={}",
                        outcome.getSearchId(), outcome.getElapsedMs(), outcome.getBytesRelayed());
                break;
            case CLIENT_DISCONNECTED:
                log.info("客户端断开|Relay_client_disconnected,searchId={},elapsedMs={},bytes={}",
                        outcome.getSearchId(), outcome.getElapsedMs(), outcome.getBytesRelayed());
                break;
            case REJECTED:
                break;
            default:
                log.warn("进度流异常终止|SSE_proxy_error,termination={},status={},errorType={},searchId={},elapsedMs={},bytes={},cause={}",
                        outcome.getTermination(), outcome.getHttpStatus(), outcome.getErrorType(),
                        outcome.getSearchId(), outcome.getElapsedMs(), outcome.getBytesRelayed(),
                        cause != null ? describe(cause) : outcome.getDetail());
        }
    }

    private static long elapsed(Stopwatch stopwatch) {
        return stopwatch.elapsed(TimeUnit.MILLISECONDS);
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
    }
}
