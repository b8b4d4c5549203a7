package com.hao.gateway.integration.correlation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.UUID;

/**
 * 会话关联 ID 生成器
 *
 * 类职责：
 * 为每个客户端会话提供一个稳定的关联 ID，用于串联同一会话跨服务的日志。
 *
 * 实现逻辑：
 * 1. 会话存储中已有则直接返回。
 * 2. 否则生成 UUID 写入会话存储后返回。
 * 3. 会话存储不可用时每次返回新生成的 ID，调用方需容忍其变化。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorrelationIdProvider {

    public static final String STORAGE_KEY = "bidiq_correlation_id";

    private final SessionStorage storage;

    public String getOrCreateCorrelationId() {
        try {
            Optional<String> existing = storage.get(STORAGE_KEY);
            if (existing.isPresent() && StringUtils.hasText(existing.get())) {
                return existing.get();
            }
            String created = UUID.randomUUID().toString();
            storage.set(STORAGE_KEY, created);
            log.debug("生成会话关联ID|Correlation_id_created,correlationId={}", created);
            return created;
        } catch (SessionStorageUnavailableException e) {
            log.debug("会话存储不可用_使用临时关联ID|Session_storage_unavailable_ephemeral_id,reason={}", e.getMessage());
            return UUID.randomUUID().toString();
        }
    }

    /**
     * 优先使用入站请求携带的关联 ID，原样转发；缺失时使用会话级 ID
     *
     * @param inbound 入站 X-Correlation-ID 头，可为 null
     * @return 下一跳使用的关联 ID
     */
    public String resolveForOutbound(String inbound) {
        return StringUtils.hasText(inbound) ? inbound : getOrCreateCorrelationId();
    }
}
