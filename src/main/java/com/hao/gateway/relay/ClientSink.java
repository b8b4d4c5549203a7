package com.hao.gateway.relay;

import java.io.IOException;

/**
 * 客户端写出端
 *
 * write 需在返回前把数据交给容器（不额外缓冲）；抛出 IOException 视为客户端已断开。
 */
public interface ClientSink {

    void write(byte[] buffer, int offset, int length) throws IOException;

    void complete();
}
