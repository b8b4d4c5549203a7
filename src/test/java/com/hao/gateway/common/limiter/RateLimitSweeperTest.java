package com.hao.gateway.common.limiter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RateLimitSweeperTest {

    @Test
    @DisplayName("遍历全部策略清理过期条目")
    void sweepsEveryPolicy() {
        SlidingWindowRateLimiterTest.MutableClock clock = new SlidingWindowRateLimiterTest.MutableClock();
        SlidingWindowRateLimiter login = new SlidingWindowRateLimiter("login", 5, Duration.ofMinutes(5), clock);
        SlidingWindowRateLimiter search = new SlidingWindowRateLimiter("search", 10, Duration.ofMinutes(1), clock);
        login.checkAndConsume("a");
        search.checkAndConsume("a");
        search.checkAndConsume("b");

        clock.advance(Duration.ofMinutes(3));
        new RateLimitSweeper(List.of(login, search)).sweep();

        assertEquals(1, login.size());
        assertEquals(0, search.size());
    }

    @Test
    @DisplayName("按策略名查找限流器，未知策略抛出异常")
    void registryLookup() {
        SlidingWindowRateLimiter login = new SlidingWindowRateLimiter("login", 5, Duration.ofMinutes(5),
                new SlidingWindowRateLimiterTest.MutableClock());
        RateLimiterRegistry registry = new RateLimiterRegistry(List.of(login));

        assertEquals(login, registry.get("login"));
        assertThrows(IllegalArgumentException.class, () -> registry.get("export"));
    }
}
