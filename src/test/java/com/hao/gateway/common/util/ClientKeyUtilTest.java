package com.hao.gateway.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ClientKeyUtilTest {

    @Test
    @DisplayName("X-Forwarded-For 取第一个地址")
    void firstForwardedAddressWins() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", "203.0.113.9, 10.0.0.1");
        request.addHeader("X-Real-IP", "10.0.0.2");

        assertEquals("203.0.113.9", ClientKeyUtil.resolve(request));
    }

    @Test
    @DisplayName("无 X-Forwarded-For 时使用 X-Real-IP")
    void fallsBackToRealIp() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Real-IP", "198.51.100.4");

        assertEquals("198.51.100.4", ClientKeyUtil.resolve(request));
    }

    @Test
    @DisplayName("都缺失时归入 unknown")
    void unknownWhenNoHeaders() {
        assertEquals("unknown", ClientKeyUtil.resolve(new MockHttpServletRequest()));
        assertEquals("unknown", ClientKeyUtil.resolve(null));
    }
}
