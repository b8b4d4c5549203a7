package com.hao.gateway.filters;

import com.hao.gateway.common.constants.GatewayHeaders;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * 链路标识过滤器
 *
 * 类职责：
 * 将入站 X-Correlation-ID（若存在）与本次请求的 X-Request-ID 放入 MDC，并回写到响应头，
 * 使请求处理期间的日志都带上相同标识。
 *
 * 注意：
 * 入站没有关联 ID 时这里不生成，关联 ID 只由会话级生成器创建。
 * 请求结束后必须清理 MDC，避免 Tomcat 线程复用导致上下文串号。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String correlationId = request.getHeader(GatewayHeaders.CORRELATION_ID);
        String requestId = request.getHeader(GatewayHeaders.REQUEST_ID);
        if (!StringUtils.hasText(requestId)) {
            requestId = UUID.randomUUID().toString();
        }

        if (StringUtils.hasText(correlationId)) {
            MDC.put(GatewayHeaders.MDC_CORRELATION_ID, correlationId);
            response.setHeader(GatewayHeaders.CORRELATION_ID, correlationId);
        }
        MDC.put(GatewayHeaders.MDC_REQUEST_ID, requestId);
        response.setHeader(GatewayHeaders.REQUEST_ID, requestId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(GatewayHeaders.MDC_CORRELATION_ID);
            MDC.remove(GatewayHeaders.MDC_REQUEST_ID);
        }
    }
}
