package com.hao.gateway.integration.correlation;

import java.util.Optional;

/**
 * 会话级键值存储能力
 *
 * 生命周期与客户端会话一致。实现方在会话不可用时抛出 {@link SessionStorageUnavailableException}。
 */
public interface SessionStorage {

    Optional<String> get(String key);

    void set(String key, String value);

    void remove(String key);
}
