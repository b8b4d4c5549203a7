package com.hao.gateway.common.limiter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.hao.gateway.common.constants.RateLimitConstants;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 单机窗口限流器
 *
 * 类职责：
 * 以客户端标识为键维护固定重置窗口的计数，窗口到期后整体清零（而非平滑衰减）。
 *
 * 核心实现思路：
 * - 条目存放在 Caffeine 缓存中，每个条目的过期时间恰好是其窗口结束时间（resetAt），
 *   缓存的时间源取自注入的 Clock，测试可手动推进。
 * - 读取、判断、递增在 asMap().compute 内完成，同一个键的并发请求串行化，
 *   不同键之间互不阻塞，杜绝超限重复放行。
 * - 不使用 maximumSize：按容量淘汰会清掉仍在窗口内的计数，等于放过攻击者。
 *   改为硬上限，跟踪的键达到 maxKeys 时拒绝新键，已有键照常计数。
 * - {@link RateLimitSweeper} 定时调用 {@link #sweepExpired()} 触发 cleanUp，与请求流量无关。
 * - 仅为进程内保护，多实例之间不做协调。
 *
 * 每个策略（登录、注册、搜索）持有独立实例，互不共享计数。
 */
@Slf4j
public class SlidingWindowRateLimiter {

    @Getter
    private final String policy;

    @Getter
    private final int limit;

    @Getter
    private final Duration window;

    @Getter
    private final long maxKeys;

    private final Clock clock;

    private final Cache<String, RateLimitEntry> entries;

    public SlidingWindowRateLimiter(String policy, int limit, Duration window, Clock clock) {
        this(policy, limit, window, clock, RateLimitConstants.MAX_TRACKED_KEYS);
    }

    public SlidingWindowRateLimiter(String policy, int limit, Duration window, Clock clock, long maxKeys) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, policy=" + policy);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, policy=" + policy);
        }
        if (maxKeys < 1) {
            throw new IllegalArgumentException("maxKeys must be >= 1, policy=" + policy);
        }
        this.policy = policy;
        this.limit = limit;
        this.window = window;
        this.maxKeys = maxKeys;
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new WindowExpiry(clock))
                // 维护任务在调用线程上执行，清理结果对调用方立即可见
                .executor(Runnable::run)
                .build();
    }

    /**
     * 按本实例配置的阈值与窗口检查并消耗一次配额
     *
     * @param key 客户端标识
     * @return 判定结果
     */
    public RateLimitDecision checkAndConsume(String key) {
        return checkAndConsume(key, limit, window);
    }

    /**
     * 检查并消耗一次配额
     *
     * 实现逻辑：
     * 1. 无条目或窗口已到期：跟踪的键未达上限时写入新条目 count=1，放行；达到上限则拒绝，不写入。
     * 2. count 未达阈值：递增后放行。
     * 3. 否则拒绝，返回距窗口结束的秒数（向上取整，至少 1 秒）。
     *
     * @param key 客户端标识
     * @param limit 窗口内允许的请求数
     * @param windowDuration 窗口长度
     * @return 判定结果
     */
    public RateLimitDecision checkAndConsume(String key, int limit, Duration windowDuration) {
        final long now = clock.millis();
        final AtomicReference<RateLimitDecision> decision = new AtomicReference<>();
        if (entries.estimatedSize() >= maxKeys) {
            // 先回收已到期条目，再判断是否真的满了
            entries.cleanUp();
        }
        final boolean full = entries.estimatedSize() >= maxKeys;

        entries.asMap().compute(key, (k, current) -> {
            if (current == null || current.isExpired(now)) {
                if (full) {
                    decision.set(RateLimitDecision.reject(retryAfterSeconds(now + windowDuration.toMillis(), now)));
                    return null;
                }
                decision.set(RateLimitDecision.allow());
                return new RateLimitEntry(1, now + windowDuration.toMillis());
            }
            if (current.getCount() < limit) {
                decision.set(RateLimitDecision.allow());
                return current.increment();
            }
            decision.set(RateLimitDecision.reject(retryAfterSeconds(current.getResetAt(), now)));
            return current;
        });

        RateLimitDecision result = decision.get();
        if (!result.isAllowed()) {
            if (full && entries.getIfPresent(key) == null) {
                log.warn("限流键数量达到上限_拒绝新键|Rate_limit_key_capacity_reached,policy={},key={},maxKeys={}",
                        policy, key, maxKeys);
            } else {
                log.warn("窗口限流拒绝|Window_rate_limited,policy={},key={},retryAfter={}s",
                        policy, key, result.getRetryAfterSeconds());
            }
        }
        return result;
    }

    /**
     * 清理所有窗口已到期的条目
     *
     * @return 本次删除的条目数
     */
    public int sweepExpired() {
        long before = entries.estimatedSize();
        entries.cleanUp();
        long remaining = entries.estimatedSize();
        int removed = (int) Math.max(0, before - remaining);
        if (removed > 0) {
            log.debug("清理过期限流条目|Rate_limit_entries_swept,policy={},removed={},remaining={}",
                    policy, removed, remaining);
        }
        return removed;
    }

    /**
     * 当前跟踪的键数量（含尚未被清理的过期条目）
     */
    public long size() {
        return entries.estimatedSize();
    }

    RateLimitEntry entry(String key) {
        return entries.getIfPresent(key);
    }

    private static int retryAfterSeconds(long resetAt, long now) {
        long remainingMillis = resetAt - now;
        long seconds = (remainingMillis + 999) / 1000;
        return (int) Math.max(1, seconds);
    }

    /**
     * 条目在 resetAt 时刻过期；递增不改变 resetAt，新窗口带来新的 resetAt
     */
    private static final class WindowExpiry implements Expiry<String, RateLimitEntry> {

        private final Clock clock;

        private WindowExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, RateLimitEntry value, long currentTime) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterUpdate(String key, RateLimitEntry value, long currentTime, long currentDuration) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterRead(String key, RateLimitEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(RateLimitEntry value) {
            return TimeUnit.MILLISECONDS.toNanos(Math.max(0L, value.getResetAt() - clock.millis()));
        }
    }
}
