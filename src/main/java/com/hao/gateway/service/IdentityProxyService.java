package com.hao.gateway.service;

import org.springframework.http.ResponseEntity;

/**
 * 身份服务转发接口
 *
 * 类职责：
 * 登录、注册请求体原样转发到身份服务，状态码与正文原样返回。
 *
 * 设计目的：
 * 网关只负责限流与链路追踪，凭证校验完全交给身份服务，控制层不感知转发细节。
 */
public interface IdentityProxyService {

    /**
     * 转发登录请求
     *
     * @param body          客户端原始 JSON 请求体，可为 null
     * @param correlationId 入站 X-Correlation-ID，为空时不向下游传递
     * @return 身份服务的状态码与正文；未配置为 503，不可达为 502
     */
    ResponseEntity<String> login(String body, String correlationId);

    /**
     * 转发注册请求
     *
     * @param body          客户端原始 JSON 请求体，可为 null
     * @param correlationId 入站 X-Correlation-ID，为空时不向下游传递
     * @return 身份服务的状态码与正文；未配置为 503，不可达为 502
     */
    ResponseEntity<String> signup(String body, String correlationId);
}
