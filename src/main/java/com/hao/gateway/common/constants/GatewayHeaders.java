package com.hao.gateway.common.constants;

/**
 * 网关使用的 HTTP 头与 MDC 键
 */
public final class GatewayHeaders {

    public static final String CORRELATION_ID = "X-Correlation-ID";

    public static final String REQUEST_ID = "X-Request-ID";

    public static final String FORWARDED_FOR = "X-Forwarded-For";

    public static final String REAL_IP = "X-Real-IP";

    public static final String ACCEL_BUFFERING = "X-Accel-Buffering";

    public static final String MDC_CORRELATION_ID = "correlation_id";

    public static final String MDC_REQUEST_ID = "request_id";

    public static final String MDC_SEARCH_ID = "search_id";

    private GatewayHeaders() {
    }
}
