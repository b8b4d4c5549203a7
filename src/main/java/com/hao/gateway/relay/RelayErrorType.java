package com.hao.gateway.relay;

/**
 * 错误响应中 error_type 字段的取值
 */
public final class RelayErrorType {

    public static final String IDLE_TIMEOUT = "UpstreamIdleTimeout";

    public static final String TERMINATED = "UpstreamTerminated";

    public static final String UPSTREAM_STATUS = "UpstreamStatus";

    public static final String EMPTY_BODY = "EmptyUpstreamBody";

    public static final String RELAY_FAILURE = "RelayFailure";

    private RelayErrorType() {
    }
}
