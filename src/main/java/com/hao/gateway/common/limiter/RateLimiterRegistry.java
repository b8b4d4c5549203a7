package com.hao.gateway.common.limiter;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 按策略名查找限流器
 *
 * 类职责：
 * 收集容器中所有 SlidingWindowRateLimiter，供限流切面与搜索协调服务按策略名取用。
 * 策略名重复时启动失败。
 */
@Component
public class RateLimiterRegistry {

    private final Map<String, SlidingWindowRateLimiter> byPolicy;

    public RateLimiterRegistry(List<SlidingWindowRateLimiter> limiters) {
        this.byPolicy = limiters.stream()
                .collect(Collectors.toUnmodifiableMap(SlidingWindowRateLimiter::getPolicy, Function.identity()));
    }

    /**
     * 按策略名获取限流器
     *
     * @param policy 策略名，见 RateLimitConstants
     * @return 对应的限流器
     * @throws IllegalArgumentException 策略未注册
     */
    public SlidingWindowRateLimiter get(String policy) {
        SlidingWindowRateLimiter limiter = byPolicy.get(policy);
        if (limiter == null) {
            throw new IllegalArgumentException("Unknown rate limit policy: " + policy);
        }
        return limiter;
    }
}
