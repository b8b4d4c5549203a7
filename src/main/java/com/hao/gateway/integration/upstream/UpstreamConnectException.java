package com.hao.gateway.integration.upstream;

import java.io.IOException;

/**
 * 无法与上游建立连接（拒绝连接、建连超时、域名无法解析等）
 */
public class UpstreamConnectException extends IOException {

    public UpstreamConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
