package com.hao.gateway.controller;

import com.hao.gateway.service.IdentityProxyService;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 登录注册入口限流测试
 *
 * 测试目的：
 * 1. 验证 @SlidingWindowLimit 在控制层生效，超限返回 429 与 Retry-After。
 * 2. 验证被拒绝的请求不会转发到身份服务。
 * 3. 验证入站关联 ID 传给身份服务。
 *
 * 设计思路：
 * 启动完整上下文，身份服务以 MockBean 替代；每个用例使用不同客户端地址，避免共享计数相互影响。
 */
@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
public class AuthControllerTest {

    private static final String LOGIN_BODY = "{\"email\":\"a@b.com\",\"password\":\"x\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IdentityProxyService identityProxyService;

    @BeforeEach
    void setUp() {
        when(identityProxyService.login(any(), any())).thenReturn(ResponseEntity.ok("{\"access_token\":\"t\"}"));
        when(identityProxyService.signup(any(), any())).thenReturn(ResponseEntity.status(201).body("{}"));
    }

    @Test
    @DisplayName("登录: 同一客户端第 6 次请求返回 429 与 Retry-After")
    void sixthLoginIsRateLimited() throws Exception {
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(post("/api/auth/login")
                            .header("X-Forwarded-For", "203.0.113.10")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(LOGIN_BODY))
                    .andExpect(status().isOk());
        }

        mockMvc.perform(post("/api/auth/login")
                        .header("X-Forwarded-For", "203.0.113.10")
                        .header("X-Correlation-ID", "corr-login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LOGIN_BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.code").value(429))
                .andExpect(jsonPath("$.retry_after_seconds").isNumber())
                .andExpect(jsonPath("$.correlation_id").value("corr-login"));

        verify(identityProxyService, times(5)).login(any(), any());
    }

    @Test
    @DisplayName("登录: 其他客户端不受影响")
    void otherClientIsNotLimited() throws Exception {
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(post("/api/auth/login").header("X-Forwarded-For", "203.0.113.20")
                    .contentType(MediaType.APPLICATION_JSON).content(LOGIN_BODY));
        }

        mockMvc.perform(post("/api/auth/login")
                        .header("X-Forwarded-For", "203.0.113.21")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LOGIN_BODY))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("注册: 10 分钟内第 4 次请求返回 429")
    void fourthSignupIsRateLimited() throws Exception {
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(post("/api/auth/signup")
                            .header("X-Forwarded-For", "203.0.113.30")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(LOGIN_BODY))
                    .andExpect(status().isCreated());
        }

        mockMvc.perform(post("/api/auth/signup")
                        .header("X-Forwarded-For", "203.0.113.30")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LOGIN_BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"));
    }

    @Test
    @DisplayName("搜索: 未携带凭证返回 401")
    void searchWithoutBearerIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/buscar")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ufs\":[\"SP\"],\"data_inicial\":\"2024-01-01\",\"data_final\":\"2024-01-31\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Autenticacao necessaria. Faca login para continuar."));
    }

    @Test
    @DisplayName("关联ID: 入站 X-Correlation-ID 交给身份服务转发，缺失时不生成")
    void correlationIdIsPassedToIdentityService() throws Exception {
        mockMvc.perform(post("/api/auth/login")
                        .header("X-Forwarded-For", "203.0.113.50")
                        .header("X-Correlation-ID", "corr-xyz")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LOGIN_BODY))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/auth/signup")
                        .header("X-Forwarded-For", "203.0.113.50")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LOGIN_BODY))
                .andExpect(status().isCreated());

        verify(identityProxyService).login(eq(LOGIN_BODY), eq("corr-xyz"));
        verify(identityProxyService).signup(eq(LOGIN_BODY), isNull());
    }

    @Test
    @DisplayName("请求ID: 每个响应都回写 X-Request-ID")
    void requestIdIsEchoed() throws Exception {
        mockMvc.perform(post("/api/auth/login")
                        .header("X-Forwarded-For", "203.0.113.40")
                        .header("X-Request-ID", "req-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LOGIN_BODY))
                .andExpect(header().string("X-Request-ID", "req-123"));
    }
}
