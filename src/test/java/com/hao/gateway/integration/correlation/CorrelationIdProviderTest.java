package com.hao.gateway.integration.correlation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

/**
 * 会话关联 ID 测试
 */
public class CorrelationIdProviderTest {

    @Test
    @DisplayName("同一会话多次获取返回同一个 ID")
    void sameSessionReturnsStableId() {
        MapSessionStorage storage = new MapSessionStorage();
        CorrelationIdProvider provider = new CorrelationIdProvider(storage);

        String first = provider.getOrCreateCorrelationId();
        String second = provider.getOrCreateCorrelationId();

        assertEquals(first, second);
        assertDoesNotThrow(() -> UUID.fromString(first));
        assertEquals(first, storage.values.get(CorrelationIdProvider.STORAGE_KEY));
    }

    @Test
    @DisplayName("已有存储值时直接复用")
    void reusesStoredId() {
        MapSessionStorage storage = new MapSessionStorage();
        storage.set(CorrelationIdProvider.STORAGE_KEY, "existing-id");

        assertEquals("existing-id", new CorrelationIdProvider(storage).getOrCreateCorrelationId());
    }

    @Test
    @DisplayName("存储不可用: 每次返回新 ID，不抛异常")
    void unavailableStorageYieldsEphemeralIds() {
        SessionStorage unavailable = new SessionStorage() {
            @Override
            public Optional<String> get(String key) {
                throw new SessionStorageUnavailableException("no session");
            }

            @Override
            public void set(String key, String value) {
                throw new SessionStorageUnavailableException("no session");
            }

            @Override
            public void remove(String key) {
                throw new SessionStorageUnavailableException("no session");
            }
        };
        CorrelationIdProvider provider = new CorrelationIdProvider(unavailable);

        assertNotEquals(provider.getOrCreateCorrelationId(), provider.getOrCreateCorrelationId());
    }

    @Test
    @DisplayName("入站关联 ID 原样转发，缺失时使用会话 ID")
    void inboundIdWinsForOutbound() {
        MapSessionStorage storage = new MapSessionStorage();
        CorrelationIdProvider provider = new CorrelationIdProvider(storage);

        assertEquals("from-client", provider.resolveForOutbound("from-client"));
        assertEquals(provider.getOrCreateCorrelationId(), provider.resolveForOutbound(null));
        assertEquals(provider.getOrCreateCorrelationId(), provider.resolveForOutbound(" "));
    }

    private static final class MapSessionStorage implements SessionStorage {

        private final Map<String, String> values = new HashMap<>();

        @Override
        public Optional<String> get(String key) {
            return Optional.ofNullable(values.get(key));
        }

        @Override
        public void set(String key, String value) {
            values.put(key, value);
        }

        @Override
        public void remove(String key) {
            values.remove(key);
        }
    }
}
