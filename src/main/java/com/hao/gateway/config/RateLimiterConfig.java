package com.hao.gateway.config;

import com.hao.gateway.common.constants.RateLimitConstants;
import com.hao.gateway.common.limiter.SlidingWindowRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;

/**
 * 限流器配置类
 *
 * 类职责：
 * 为每个敏感入口构建独立的窗口限流器实例，阈值与窗口来自 gateway.rate-limit.policies。
 *
 * 实现思路：
 * - 同一实现、不同策略参数，各实例计数互不影响。
 * - 配置缺失时回退到 RateLimitConstants 中的缺省值。
 */
@Slf4j
@Configuration
public class RateLimiterConfig {

    @Bean
    public Clock gatewayClock() {
        return Clock.systemUTC();
    }

    /**
     * 过期条目清理使用的调度器，与中继看门狗分开
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("rate-limit-sweep-");
        scheduler.setDaemon(true);
        return scheduler;
    }

    @Bean
    public SlidingWindowRateLimiter loginRateLimiter(GatewayProperties properties, Clock gatewayClock) {
        return build(properties, RateLimitConstants.POLICY_LOGIN,
                RateLimitConstants.LOGIN_LIMIT, Duration.ofMinutes(RateLimitConstants.LOGIN_WINDOW_MINUTES), gatewayClock);
    }

    @Bean
    public SlidingWindowRateLimiter signupRateLimiter(GatewayProperties properties, Clock gatewayClock) {
        return build(properties, RateLimitConstants.POLICY_SIGNUP,
                RateLimitConstants.SIGNUP_LIMIT, Duration.ofMinutes(RateLimitConstants.SIGNUP_WINDOW_MINUTES), gatewayClock);
    }

    @Bean
    public SlidingWindowRateLimiter searchRateLimiter(GatewayProperties properties, Clock gatewayClock) {
        return build(properties, RateLimitConstants.POLICY_SEARCH,
                RateLimitConstants.SEARCH_LIMIT, Duration.ofMinutes(RateLimitConstants.SEARCH_WINDOW_MINUTES), gatewayClock);
    }

    private SlidingWindowRateLimiter build(GatewayProperties properties, String policy,
                                           int defaultLimit, Duration defaultWindow, Clock clock) {
        GatewayProperties.Policy configured = properties.getRateLimit().getPolicies().get(policy);
        int limit = configured != null && configured.getLimit() > 0 ? configured.getLimit() : defaultLimit;
        Duration window = configured != null && configured.getWindow() != null ? configured.getWindow() : defaultWindow;
        long maxKeys = properties.getRateLimit().getMaxTrackedKeys();
        log.info("创建限流器|Rate_limiter_created,policy={},limit={},window={},maxKeys={}", policy, limit, window, maxKeys);
        return new SlidingWindowRateLimiter(policy, limit, window, clock, maxKeys);
    }
}
