package com.hao.gateway.relay;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 客户端侧取消信号
 *
 * 只触发一次；触发后注册的监听器会立即执行。
 */
@Slf4j
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get()) {
            listener.run();
        }
    }

    /**
     * 触发取消
     *
     * @param reason 触发原因，仅用于日志
     * @return 本次调用是否真正触发
     */
    public boolean cancel(String reason) {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        log.debug("客户端取消信号触发|Client_cancel_signal_fired,reason={}", reason);
        for (Runnable listener : listeners) {
            listener.run();
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
