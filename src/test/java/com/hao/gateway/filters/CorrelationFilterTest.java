package com.hao.gateway.filters;

import com.hao.gateway.common.constants.GatewayHeaders;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * 链路标识过滤器测试
 */
public class CorrelationFilterTest {

    private final CorrelationFilter filter = new CorrelationFilter();

    @Test
    @DisplayName("入站关联ID放入MDC并回写，请求结束后清理")
    void propagatesInboundCorrelationId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/buscar-progress");
        request.addHeader(GatewayHeaders.CORRELATION_ID, "corr-42");
        request.addHeader(GatewayHeaders.REQUEST_ID, "req-7");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenCorrelation = new AtomicReference<>();
        AtomicReference<String> seenRequest = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                seenCorrelation.set(MDC.get(GatewayHeaders.MDC_CORRELATION_ID));
                seenRequest.set(MDC.get(GatewayHeaders.MDC_REQUEST_ID));
            }
        });

        assertEquals("corr-42", seenCorrelation.get());
        assertEquals("req-7", seenRequest.get());
        assertEquals("corr-42", response.getHeader(GatewayHeaders.CORRELATION_ID));
        assertEquals("req-7", response.getHeader(GatewayHeaders.REQUEST_ID));
        assertNull(MDC.get(GatewayHeaders.MDC_CORRELATION_ID));
        assertNull(MDC.get(GatewayHeaders.MDC_REQUEST_ID));
    }

    @Test
    @DisplayName("无入站关联ID时不生成，请求ID总会生成")
    void generatesRequestIdOnly() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/buscar");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertNull(response.getHeader(GatewayHeaders.CORRELATION_ID));
        assertNotNull(response.getHeader(GatewayHeaders.REQUEST_ID));
    }
}
