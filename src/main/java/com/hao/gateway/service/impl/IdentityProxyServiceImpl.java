package com.hao.gateway.service.impl;

import com.hao.gateway.common.constants.GatewayHeaders;
import com.hao.gateway.config.GatewayProperties;
import com.hao.gateway.service.IdentityProxyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * 身份服务转发实现
 *
 * 类职责：
 * 把登录、注册请求透传到 gateway.identity.url 下的同名路径。
 *
 * 实现思路：
 * - 身份服务未配置返回 503，网络失败返回 502，其余状态码与正文原样返回。
 * - 入站 X-Correlation-ID 原样传给身份服务；没有时不生成，由身份服务自行处理。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityProxyServiceImpl implements IdentityProxyService {

    private final RestTemplate restTemplate;

    private final GatewayProperties properties;

    @Override
    public ResponseEntity<String> login(String body, String correlationId) {
        return forward("/login", body, correlationId);
    }

    @Override
    public ResponseEntity<String> signup(String body, String correlationId) {
        return forward("/signup", body, correlationId);
    }

    /**
     * 转发到身份服务
     *
     * 实现逻辑：
     * 1. 未配置地址直接返回 503。
     * 2. 以 JSON 发送请求体，附带入站关联 ID（仅在非空时）。
     * 3. 传输层失败返回 502，否则原样返回上游响应。
     */
    private ResponseEntity<String> forward(String path, String body, String correlationId) {
        GatewayProperties.Identity identity = properties.getIdentity();
        if (!identity.isConfigured()) {
            log.error("身份服务未配置|Identity_url_not_configured,path={}", path);
            return json(HttpStatus.SERVICE_UNAVAILABLE, "{\"message\":\"Servidor nao configurado. Contate o suporte.\"}");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.hasText(correlationId)) {
            headers.set(GatewayHeaders.CORRELATION_ID, correlationId);
        }
        String url = identity.getUrl().replaceAll("/+$", "") + path;
        try {
            ResponseEntity<String> upstream = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
            log.info("身份请求转发完成|Identity_forwarded,path={},status={}", path, upstream.getStatusCode().value());
            MediaType contentType = upstream.getHeaders().getContentType();
            return ResponseEntity.status(upstream.getStatusCode())
                    .contentType(contentType != null ? contentType : MediaType.APPLICATION_JSON)
                    .body(upstream.getBody());
        } catch (ResourceAccessException e) {
            log.error("身份服务不可达|Identity_unreachable,path={},reason={}", path, e.getMessage());
            return json(HttpStatus.BAD_GATEWAY, "{\"message\":\"Servico de autenticacao indisponivel.\"}");
        }
    }

    private static ResponseEntity<String> json(HttpStatus status, String body) {
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }
}
