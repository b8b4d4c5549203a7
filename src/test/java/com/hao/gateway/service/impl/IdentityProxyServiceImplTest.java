package com.hao.gateway.service.impl;

import com.hao.gateway.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * 身份服务转发测试
 *
 * 测试目的：
 * 1. 请求体、状态码与正文原样透传。
 * 2. 入站关联 ID 原样转发，缺失时不生成。
 * 3. 未配置与不可达分别返回 503 与 502。
 */
public class IdentityProxyServiceImplTest {

    private GatewayProperties properties;

    private MockRestServiceServer server;

    private IdentityProxyServiceImpl service;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getIdentity().setUrl("http://identity.test/auth/");
        RestTemplate restTemplate = new RestTemplate();
        restTemplate.setErrorHandler(new DefaultResponseErrorHandler() {
            @Override
            public boolean hasError(ClientHttpResponse response) {
                return false;
            }
        });
        server = MockRestServiceServer.bindTo(restTemplate).build();
        service = new IdentityProxyServiceImpl(restTemplate, properties);
    }

    @Test
    @DisplayName("登录: 请求体原样转发，状态码与正文原样返回")
    void loginIsForwarded() {
        server.expect(requestTo("http://identity.test/auth/login"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"email\":\"a@b.com\"}"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"detail\":\"Credenciais invalidas\"}"));

        ResponseEntity<String> response = service.login("{\"email\":\"a@b.com\"}", null);

        server.verify();
        assertEquals(401, response.getStatusCode().value());
        assertEquals("{\"detail\":\"Credenciais invalidas\"}", response.getBody());
    }

    @Test
    @DisplayName("关联ID: 入站 X-Correlation-ID 原样转发给身份服务")
    void correlationIdIsForwarded() {
        server.expect(requestTo("http://identity.test/auth/login"))
                .andExpect(header("X-Correlation-ID", "corr-xyz"))
                .andRespond(withSuccess("{\"access_token\":\"t\"}", MediaType.APPLICATION_JSON));

        ResponseEntity<String> response = service.login("{}", "corr-xyz");

        server.verify();
        assertEquals(200, response.getStatusCode().value());
    }

    @Test
    @DisplayName("关联ID: 入站缺失时不生成")
    void missingCorrelationIdIsNotSynthesized() {
        server.expect(requestTo("http://identity.test/auth/signup"))
                .andExpect(headerDoesNotExist("X-Correlation-ID"))
                .andRespond(withStatus(HttpStatus.CREATED).contentType(MediaType.APPLICATION_JSON).body("{}"));

        ResponseEntity<String> response = service.signup("{}", " ");

        server.verify();
        assertEquals(201, response.getStatusCode().value());
    }

    @Test
    @DisplayName("身份服务未配置: 503")
    void unconfiguredIdentityIsServiceUnavailable() {
        properties.getIdentity().setUrl("");

        assertEquals(503, service.signup("{}", null).getStatusCode().value());
    }

    @Test
    @DisplayName("身份服务不可达: 502")
    void transportFailureIsBadGateway() {
        server.expect(requestTo("http://identity.test/auth/signup"))
                .andRespond(request -> {
                    throw new ConnectException("Connection refused");
                });

        assertEquals(502, service.signup("{}", null).getStatusCode().value());
    }
}
