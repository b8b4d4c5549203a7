package com.hao.gateway.common.limiter;

import lombok.Value;

/**
 * 限流窗口条目
 *
 * count 为当前窗口内已放行的请求数，resetAt 为窗口结束时间（毫秒时间戳）。
 * 条目不可变，计数递增通过替换实现，便于清理任务做条件删除。
 */
@Value
public class RateLimitEntry {

    int count;

    long resetAt;

    public boolean isExpired(long now) {
        return now >= resetAt;
    }

    RateLimitEntry increment() {
        return new RateLimitEntry(count + 1, resetAt);
    }
}
