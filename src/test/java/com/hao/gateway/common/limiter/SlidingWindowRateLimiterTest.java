package com.hao.gateway.common.limiter;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 窗口限流器测试
 *
 * 测试目的：
 * 1. 窗口内超过阈值即拒绝，并给出正确的重试秒数。
 * 2. 窗口到期后重置计数。
 * 3. 并发访问同一个键时放行数恰好等于阈值。
 * 4. 清理任务只删除已到期条目。
 * 5. 跟踪的键达到上限时拒绝新键，不淘汰仍在窗口内的计数。
 */
@Slf4j
public class SlidingWindowRateLimiterTest {

    @Test
    @DisplayName("登录策略: 5 分钟内第 6 次请求被拒绝")
    void sixthLoginAttemptIsRejected() {
        MutableClock clock = new MutableClock();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter("login", 5, Duration.ofMinutes(5), clock);

        for (int i = 1; i <= 5; i++) {
            assertTrue(limiter.checkAndConsume("1.2.3.4").isAllowed(), "第 " + i + " 次请求应放行");
        }
        clock.advance(Duration.ofSeconds(10));
        RateLimitDecision sixth = limiter.checkAndConsume("1.2.3.4");

        assertFalse(sixth.isAllowed());
        assertEquals(290, sixth.getRetryAfterSeconds());
        assertEquals(5, limiter.entry("1.2.3.4").getCount());
    }

    @Test
    @DisplayName("不同客户端独立计数")
    void keysAreIndependent() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter("signup", 3, Duration.ofMinutes(10), new MutableClock());

        for (int i = 0; i < 3; i++) {
            limiter.checkAndConsume("a");
        }

        assertFalse(limiter.checkAndConsume("a").isAllowed());
        assertTrue(limiter.checkAndConsume("b").isAllowed());
    }

    @Test
    @DisplayName("窗口到期后计数重置")
    void windowResetsAfterExpiry() {
        MutableClock clock = new MutableClock();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter("search", 2, Duration.ofMinutes(1), clock);
        limiter.checkAndConsume("k");
        limiter.checkAndConsume("k");
        assertFalse(limiter.checkAndConsume("k").isAllowed());

        clock.advance(Duration.ofSeconds(60));

        assertTrue(limiter.checkAndConsume("k").isAllowed());
        assertEquals(1, limiter.entry("k").getCount());
    }

    @Test
    @DisplayName("重试秒数向上取整且至少为 1")
    void retryAfterIsCeiledAndAtLeastOne() {
        MutableClock clock = new MutableClock();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter("search", 1, Duration.ofSeconds(10), clock);
        limiter.checkAndConsume("k");

        clock.advance(Duration.ofMillis(8_500));
        assertEquals(2, limiter.checkAndConsume("k").getRetryAfterSeconds());

        clock.advance(Duration.ofMillis(1_499));
        assertEquals(1, limiter.checkAndConsume("k").getRetryAfterSeconds());
    }

    @Test
    @DisplayName("并发访问同一键: 放行数恰好等于阈值")
    void concurrentRequestsAdmitExactlyLimit() throws InterruptedException {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter("search", 10, Duration.ofMinutes(1), Clock.systemUTC());
        int threads = 32;
        int requestsPerThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger admitted = new AtomicInteger();

        for (int t = 0; t < threads; t++) {
            executor.execute(() -> {
                try {
                    start.await();
                    for (int i = 0; i < requestsPerThread; i++) {
                        if (limiter.checkAndConsume("shared").isAllowed()) {
                            admitted.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        log.info("并发放行数|Concurrent_admitted,admitted={}", admitted.get());
        assertEquals(10, admitted.get());
    }

    @Test
    @DisplayName("清理任务: 只删除已到期条目")
    void sweepRemovesOnlyExpiredEntries() {
        MutableClock clock = new MutableClock();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter("login", 5, Duration.ofMinutes(5), clock);
        limiter.checkAndConsume("old");
        clock.advance(Duration.ofMinutes(4));
        limiter.checkAndConsume("recent");

        clock.advance(Duration.ofMinutes(4));
        int removed = limiter.sweepExpired();

        assertEquals(1, removed);
        assertNull(limiter.entry("old"));
        assertEquals(1, limiter.entry("recent").getCount());
        assertEquals(1, limiter.size());
    }

    @Test
    @DisplayName("键数量上限: 达到上限后拒绝新键，已有键照常计数")
    void rejectsNewKeysOnceCapacityIsReached() {
        MutableClock clock = new MutableClock();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter("login", 5, Duration.ofMinutes(5), clock, 2);
        assertTrue(limiter.checkAndConsume("10.0.0.1").isAllowed());
        assertTrue(limiter.checkAndConsume("10.0.0.2").isAllowed());

        RateLimitDecision rotated = limiter.checkAndConsume("10.0.0.3");

        assertFalse(rotated.isAllowed());
        assertEquals(300, rotated.getRetryAfterSeconds());
        assertNull(limiter.entry("10.0.0.3"));
        assertEquals(2, limiter.size());
        assertTrue(limiter.checkAndConsume("10.0.0.1").isAllowed());
        assertEquals(2, limiter.entry("10.0.0.1").getCount());
    }

    @Test
    @DisplayName("键数量上限: 过期条目回收后新键可再次进入")
    void expiredEntriesFreeCapacity() {
        MutableClock clock = new MutableClock();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter("search", 10, Duration.ofMinutes(1), clock, 1);
        limiter.checkAndConsume("first");
        assertFalse(limiter.checkAndConsume("second").isAllowed());

        clock.advance(Duration.ofMinutes(3));

        assertTrue(limiter.checkAndConsume("second").isAllowed());
        assertNull(limiter.entry("first"));
    }

    @Test
    @DisplayName("非法参数: 阈值小于 1 或窗口非正")
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> new SlidingWindowRateLimiter("x", 0, Duration.ofMinutes(1), Clock.systemUTC()));
        assertThrows(IllegalArgumentException.class,
                () -> new SlidingWindowRateLimiter("x", 1, Duration.ZERO, Clock.systemUTC()));
        assertThrows(IllegalArgumentException.class,
                () -> new SlidingWindowRateLimiter("x", 1, Duration.ofMinutes(1), Clock.systemUTC(), 0));
    }

    /**
     * 可手动推进的时钟
     */
    static final class MutableClock extends Clock {

        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
