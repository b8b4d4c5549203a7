package com.hao.gateway.common.aspect;

import com.hao.gateway.common.exception.RateLimitException;
import com.hao.gateway.common.limiter.RateLimitDecision;
import com.hao.gateway.common.limiter.RateLimiterRegistry;
import com.hao.gateway.common.limiter.SlidingWindowRateLimiter;
import com.hao.gateway.common.util.ClientKeyUtil;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * 窗口限流切面
 *
 * 类职责：
 * 拦截带有 @SlidingWindowLimit 注解的方法，按客户端地址执行对应策略的窗口限流。
 *
 * 实现思路：
 * - 使用 @Around 环绕通知，在业务执行前检查配额。
 * - 被拒绝时抛出 RateLimitException，由 GlobalExceptionHandler 转换为 429 与 Retry-After。
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class SlidingWindowLimitAspect {

    private final RateLimiterRegistry registry;

    @Around("@annotation(limit)")
    public Object around(ProceedingJoinPoint point, SlidingWindowLimit limit) throws Throwable {
        SlidingWindowRateLimiter limiter = registry.get(limit.policy());
        String clientKey = ClientKeyUtil.resolve(getCurrentRequest());

        RateLimitDecision decision = limiter.checkAndConsume(clientKey);
        if (!decision.isAllowed()) {
            log.warn("入口限流拦截|Entry_rate_limited,policy={},client={},retryAfter={}s",
                    limit.policy(), clientKey, decision.getRetryAfterSeconds());
            throw new RateLimitException(limit.message(), decision.getRetryAfterSeconds());
        }
        return point.proceed();
    }

    private HttpServletRequest getCurrentRequest() {
        ServletRequestAttributes attributes =
                (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        return attributes != null ? attributes.getRequest() : null;
    }
}
