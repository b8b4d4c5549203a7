package com.hao.gateway.common.exception;

import lombok.Getter;

/**
 * 限流异常定义
 *
 * 类职责：
 * 限流触发时中断业务流程，携带建议的重试等待秒数，
 * 由 GlobalExceptionHandler 统一转换为 HTTP 429。
 */
@Getter
public class RateLimitException extends RuntimeException {

    private final int retryAfterSeconds;

    public RateLimitException(String message, int retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
    }
}
