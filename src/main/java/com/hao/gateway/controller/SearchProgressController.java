package com.hao.gateway.controller;

import com.hao.gateway.common.constants.GatewayHeaders;
import com.hao.gateway.relay.CancellationSignal;
import com.hao.gateway.relay.RelayHandshake;
import com.hao.gateway.relay.RelayOutcome;
import com.hao.gateway.relay.StreamRequest;
import com.hao.gateway.relay.StreamSession;
import com.hao.gateway.relay.StreamingRelay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.io.IOException;
import java.util.Map;

/**
 * 搜索进度流控制器
 *
 * 类职责：
 * 为浏览器提供 SSE 进度流入口，把请求交给 StreamingRelay 中继到后端。
 *
 * 实现思路：
 * - 建连在请求线程完成，失败时以独立状态码返回（无 error_type 时为纯文本，否则为 JSON）。
 * - 建连成功后返回事件流响应，转发在 relayExecutor 上执行，不占用容器线程。
 * - emitter 的完成、超时、错误回调都触发取消信号，上游请求随之中断。
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SearchProgressController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final StreamingRelay streamingRelay;

    private final ThreadPoolTaskExecutor relayExecutor;

    /**
     * 打开搜索进度流
     *
     * 实现逻辑：
     * 1. 令牌优先取 query 参数 token，否则取 Authorization 的 Bearer 值。
     * 2. 在请求线程上建连；失败时直接返回分类后的状态码与正文。
     * 3. 建连成功后把转发任务交给 relayExecutor；线程池已满则释放上游并返回 503。
     * 4. 返回 text/event-stream 响应，关闭代理缓冲与内容变换。
     *
     * @param searchId      搜索 ID，缺失返回 400
     * @param token         浏览器 EventSource 无法设置请求头时使用的令牌
     * @param correlationId 入站关联 ID，原样转发给后端
     * @param authorization Authorization 头
     * @return 事件流响应，或建连失败时的错误响应
     */
    @GetMapping("/buscar-progress")
    public ResponseEntity<ResponseBodyEmitter> progress(
            @RequestParam(name = "search_id", required = false) String searchId,
            @RequestParam(name = "token", required = false) String token,
            @RequestHeader(name = GatewayHeaders.CORRELATION_ID, required = false) String correlationId,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {

        StreamRequest request = StreamRequest.builder()
                .searchId(searchId)
                .token(resolveToken(token, authorization))
                .correlationId(correlationId)
                .build();

        CancellationSignal signal = new CancellationSignal();
        RelayHandshake handshake = streamingRelay.connect(request, signal);
        if (!handshake.isStreaming()) {
            return terminated(handshake.getOutcome());
        }

        StreamSession session = handshake.getSession();
        // 永不超时，生命周期由看门狗与上游决定
        ResponseBodyEmitter emitter = new ResponseBodyEmitter(0L);
        emitter.onCompletion(() -> signal.cancel("emitter_completed"));
        emitter.onTimeout(() -> signal.cancel("emitter_timeout"));
        emitter.onError(e -> signal.cancel("emitter_error"));

        Map<String, String> mdcContext = MDC.getCopyOfContextMap();
        try {
            relayExecutor.execute(() -> {
                if (mdcContext != null) {
                    MDC.setContextMap(mdcContext);
                }
                MDC.put(GatewayHeaders.MDC_SEARCH_ID, searchId);
                try {
                    streamingRelay.forward(session, new EmitterClientSink(emitter));
                } finally {
                    MDC.clear();
                }
            });
        } catch (TaskRejectedException e) {
            log.error("中继线程池已满|Relay_capacity_exhausted,searchId={}", searchId);
            streamingRelay.abandon(session);
            return plain(HttpStatus.SERVICE_UNAVAILABLE.value(), "Relay capacity exhausted");
        }

        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .cacheControl(CacheControl.noCache().noTransform())
                .header(HttpHeaders.CONNECTION, "keep-alive")
                .header(GatewayHeaders.ACCEL_BUFFERING, "no")
                .body(emitter);
    }

    private ResponseEntity<ResponseBodyEmitter> terminated(RelayOutcome outcome) {
        if (!outcome.isStructured()) {
            return plain(outcome.getHttpStatus(), outcome.getDetail());
        }
        ResponseBodyEmitter emitter = new ResponseBodyEmitter();
        try {
            emitter.send(outcome.toErrorBody(), MediaType.APPLICATION_JSON);
            emitter.complete();
        } catch (IOException e) {
            emitter.completeWithError(e);
        }
        return ResponseEntity.status(outcome.getHttpStatus())
                .contentType(MediaType.APPLICATION_JSON)
                .body(emitter);
    }

    private ResponseEntity<ResponseBodyEmitter> plain(int status, String text) {
        ResponseBodyEmitter emitter = new ResponseBodyEmitter();
        try {
            emitter.send(text == null ? "" : text, MediaType.TEXT_PLAIN);
            emitter.complete();
        } catch (IOException e) {
            emitter.completeWithError(e);
        }
        return ResponseEntity.status(status)
                .contentType(MediaType.TEXT_PLAIN)
                .body(emitter);
    }

    private static String resolveToken(String token, String authorization) {
        if (StringUtils.hasText(token)) {
            return token;
        }
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length());
        }
        return null;
    }
}
