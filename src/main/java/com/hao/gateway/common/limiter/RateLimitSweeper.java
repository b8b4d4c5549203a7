package com.hao.gateway.common.limiter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 限流条目定时清理任务
 *
 * 与请求处理相互独立，按固定间隔遍历全部策略的限流器并删除已到期条目，
 * 防止大量不同客户端标识导致内存持续增长。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitSweeper {

    private final List<SlidingWindowRateLimiter> limiters;

    @Scheduled(fixedDelayString = "${gateway.rate-limit.sweep-interval:PT1M}",
            initialDelayString = "${gateway.rate-limit.sweep-interval:PT1M}")
    public void sweep() {
        int total = 0;
        for (SlidingWindowRateLimiter limiter : limiters) {
            try {
                total += limiter.sweepExpired();
            } catch (RuntimeException e) {
                log.error("限流条目清理异常|Rate_limit_sweep_error,policy={}", limiter.getPolicy(), e);
            }
        }
        if (total > 0) {
            log.info("限流条目清理完成|Rate_limit_sweep_done,removed={}", total);
        }
    }
}
