package com.hao.gateway.integration.correlation;

/**
 * 当前上下文没有可用的会话存储（例如非请求线程）
 */
public class SessionStorageUnavailableException extends IllegalStateException {

    public SessionStorageUnavailableException(String message) {
        super(message);
    }
}
