package com.hao.gateway.relay;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次中继的终止结果
 *
 * errorType 为 null 时表示简单拒绝，使用纯文本响应（detail 即正文）；
 * 否则使用结构化 JSON，见 {@link #toErrorBody()}。
 */
@Value
@Builder
public class RelayOutcome {

    public static final int STATUS_CLIENT_CLOSED_REQUEST = 499;

    RelayTermination termination;

    int httpStatus;

    String error;

    String errorType;

    String detail;

    String searchId;

    long elapsedMs;

    long bytesRelayed;

    public boolean isStructured() {
        return errorType != null;
    }

    public Map<String, Object> toErrorBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("detail", detail);
        body.put("error_type", errorType);
        body.put("search_id", searchId);
        body.put("elapsed_ms", elapsedMs);
        return body;
    }

    static RelayOutcome rejected(int status, String text, String searchId) {
        return RelayOutcome.builder()
                .termination(RelayTermination.REJECTED)
                .httpStatus(status)
                .detail(text)
                .searchId(searchId)
                .build();
    }

    static RelayOutcome clientDisconnected(String searchId, long elapsedMs, long bytes) {
        return RelayOutcome.builder()
                .termination(RelayTermination.CLIENT_DISCONNECTED)
                .httpStatus(STATUS_CLIENT_CLOSED_REQUEST)
                .detail("Client disconnected")
                .searchId(searchId)
                .elapsedMs(elapsedMs)
                .bytesRelayed(bytes)
                .build();
    }

    static RelayOutcome timeout(String errorType, String detail, String searchId, long elapsedMs, long bytes) {
        return RelayOutcome.builder()
                .termination(RelayTermination.UPSTREAM_TIMEOUT)
                .httpStatus(504)
                .error("SSE stream timeout")
                .errorType(errorType)
                .detail(detail)
                .searchId(searchId)
                .elapsedMs(elapsedMs)
                .bytesRelayed(bytes)
                .build();
    }

    static RelayOutcome upstreamError(int status, String errorType, String detail, String searchId, long elapsedMs, long bytes) {
        return RelayOutcome.builder()
                .termination(RelayTermination.UPSTREAM_ERROR)
                .httpStatus(status)
                .error(errorType != null ? "Backend error" : null)
                .errorType(errorType)
                .detail(detail)
                .searchId(searchId)
                .elapsedMs(elapsedMs)
                .bytesRelayed(bytes)
                .build();
    }

    static RelayOutcome completed(String searchId, long elapsedMs, long bytes) {
        return RelayOutcome.builder()
                .termination(RelayTermination.COMPLETED)
                .httpStatus(200)
                .searchId(searchId)
                .elapsedMs(elapsedMs)
                .bytesRelayed(bytes)
                .build();
    }
}
