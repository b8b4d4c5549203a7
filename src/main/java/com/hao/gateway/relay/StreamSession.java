package com.hao.gateway.relay;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.hao.gateway.integration.upstream.UpstreamConnection;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 单次中继会话
 *
 * 持有上游连接、客户端取消信号、计时器与看门狗任务，仅存活于一次中继过程。
 *
 * 不变量：
 * - abortUpstream 最多真正执行一次，且连接释放后不再执行；
 * - release 恰好执行一次，无论从哪条路径退出。
 */
@Slf4j
public class StreamSession {

    @Getter
    private final String searchId;

    @Getter
    private final CancellationSignal signal;

    private final UpstreamConnection connection;

    private final Ticker ticker;

    private final Stopwatch stopwatch;

    private final AtomicLong lastActivityNanos;

    private final AtomicLong bytesRelayed = new AtomicLong();

    private final AtomicBoolean aborted = new AtomicBoolean();

    private final AtomicBoolean released = new AtomicBoolean();

    private final AtomicBoolean idleExpired = new AtomicBoolean();

    private volatile ScheduledFuture<?> watchdog;

    StreamSession(String searchId, CancellationSignal signal, UpstreamConnection connection,
                  Ticker ticker, Stopwatch stopwatch) {
        this.searchId = searchId;
        this.signal = signal;
        this.connection = connection;
        this.ticker = ticker;
        this.stopwatch = stopwatch;
        this.lastActivityNanos = new AtomicLong(ticker.read());
    }

    InputStream body() throws IOException {
        return connection.body();
    }

    void touch(int bytes) {
        bytesRelayed.addAndGet(bytes);
        lastActivityNanos.set(ticker.read());
    }

    long idleNanos() {
        return ticker.read() - lastActivityNanos.get();
    }

    /**
     * 中断上游连接
     *
     * @return 本次调用是否真正执行了中断
     */
    boolean abortUpstream(String reason) {
        if (released.get() || !aborted.compareAndSet(false, true)) {
            return false;
        }
        log.info("中断上游连接|Upstream_aborted,searchId={},reason={}", searchId, reason);
        connection.abort();
        return true;
    }

    /**
     * 标记空闲超时并中断上游，阻塞中的读取随之抛出异常
     */
    void expireIdle() {
        if (idleExpired.compareAndSet(false, true)) {
            abortUpstream("idle_timeout");
        }
    }

    boolean isIdleExpired() {
        return idleExpired.get();
    }

    boolean isClientCancelled() {
        return signal.isCancelled();
    }

    void attachWatchdog(ScheduledFuture<?> watchdog) {
        this.watchdog = watchdog;
        if (released.get()) {
            watchdog.cancel(false);
        }
    }

    /**
     * 释放上游连接，重复调用无副作用
     */
    void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        ScheduledFuture<?> task = watchdog;
        if (task != null) {
            task.cancel(false);
        }
        try {
            connection.close();
        } catch (IOException e) {
            log.warn("关闭上游连接异常|Upstream_close_error,searchId={},message={}", searchId, e.getMessage());
        }
    }

    public boolean isReleased() {
        return released.get();
    }

    public long elapsedMs() {
        return stopwatch.elapsed(TimeUnit.MILLISECONDS);
    }

    public long bytesRelayed() {
        return bytesRelayed.get();
    }
}
