package com.hao.gateway.integration.upstream;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * 已建立的上游流式连接
 *
 * abort 用于协作式取消：中断正在阻塞的读取并放弃底层连接；close 释放连接资源。
 * 两者都可能被不同线程调用，实现方需保证线程安全。
 */
public interface UpstreamConnection extends Closeable {

    int status();

    /**
     * 响应体；上游没有返回响应体时为 null
     */
    InputStream body() throws IOException;

    void abort();

    @Override
    void close() throws IOException;
}
