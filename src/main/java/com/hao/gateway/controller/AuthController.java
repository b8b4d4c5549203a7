package com.hao.gateway.controller;

import com.hao.gateway.common.aspect.SlidingWindowLimit;
import com.hao.gateway.common.constants.GatewayHeaders;
import com.hao.gateway.common.constants.RateLimitConstants;
import com.hao.gateway.service.IdentityProxyService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 登录与注册入口
 *
 * 类职责：
 * 暴露 /api/auth/login 与 /api/auth/signup，按客户端地址限流后透传到身份服务。
 *
 * 为什么需要该类：
 * 登录、注册是暴力破解与批量注册的主要入口，限流必须在网关这一层拦下，
 * 被拒绝的请求不会到达身份服务。
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final IdentityProxyService identityProxyService;

    /**
     * 登录
     *
     * @param body          登录请求体，原样转发
     * @param correlationId 入站关联 ID，原样转发
     * @return 身份服务响应；超限时由切面抛出 RateLimitException，返回 429
     */
    @PostMapping("/login")
    @SlidingWindowLimit(policy = RateLimitConstants.POLICY_LOGIN,
            message = "Muitas tentativas de login. Aguarde alguns minutos.")
    public ResponseEntity<String> login(
            @RequestBody(required = false) String body,
            @RequestHeader(name = GatewayHeaders.CORRELATION_ID, required = false) String correlationId) {
        return identityProxyService.login(body, correlationId);
    }

    /**
     * 注册
     *
     * @param body          注册请求体，原样转发
     * @param correlationId 入站关联 ID，原样转发
     * @return 身份服务响应；超限时返回 429
     */
    @PostMapping("/signup")
    @SlidingWindowLimit(policy = RateLimitConstants.POLICY_SIGNUP,
            message = "Muitas tentativas de cadastro. Aguarde alguns minutos.")
    public ResponseEntity<String> signup(
            @RequestBody(required = false) String body,
            @RequestHeader(name = GatewayHeaders.CORRELATION_ID, required = false) String correlationId) {
        return identityProxyService.signup(body, correlationId);
    }
}
