package com.hao.gateway.common.limiter;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 限流判定结果
 *
 * allowed 为 false 时 retryAfterSeconds 至少为 1。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RateLimitDecision {

    private static final RateLimitDecision ALLOWED = new RateLimitDecision(true, 0);

    boolean allowed;

    int retryAfterSeconds;

    public static RateLimitDecision allow() {
        return ALLOWED;
    }

    public static RateLimitDecision reject(int retryAfterSeconds) {
        return new RateLimitDecision(false, Math.max(1, retryAfterSeconds));
    }
}
