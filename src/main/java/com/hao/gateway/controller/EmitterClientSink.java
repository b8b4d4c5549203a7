package com.hao.gateway.controller;

import com.hao.gateway.relay.ClientSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.io.IOException;
import java.util.Arrays;

/**
 * 基于 ResponseBodyEmitter 的客户端写出端
 *
 * 每次 send 都会立即 flush；容器初始化前的写入会被 emitter 暂存，所以这里复制缓冲区。
 */
@Slf4j
class EmitterClientSink implements ClientSink {

    private static final MediaType EVENT_STREAM = MediaType.TEXT_EVENT_STREAM;

    private final ResponseBodyEmitter emitter;

    EmitterClientSink(ResponseBodyEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void write(byte[] buffer, int offset, int length) throws IOException {
        try {
            emitter.send(Arrays.copyOfRange(buffer, offset, offset + length), EVENT_STREAM);
        } catch (IllegalStateException e) {
            // emitter 已结束，等同于客户端断开
            throw new IOException("Response already completed", e);
        }
    }

    @Override
    public void complete() {
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("响应已结束_忽略complete|Emitter_already_completed,reason={}", e.getMessage());
        }
    }
}
