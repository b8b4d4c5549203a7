package com.hao.gateway.controller;

import com.hao.gateway.common.constants.GatewayHeaders;
import com.hao.gateway.common.model.SearchResponse;
import com.hao.gateway.common.util.ClientKeyUtil;
import com.hao.gateway.service.SearchService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 搜索入口控制器
 *
 * 只负责提取请求头与客户端标识，业务委托给 SearchService。
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SearchController {

    private final SearchService searchService;

    /**
     * 发起搜索
     *
     * @param body          搜索条件（ufs、data_inicial、data_final 等）
     * @param authorization Bearer 凭证，缺失返回 401
     * @param correlationId 入站关联 ID，缺失时使用会话级 ID
     * @param request       用于解析客户端标识
     * @return 后端结果附加 search_id、progress_url、correlation_id 与 reliability，或带 message 的错误正文
     */
    @PostMapping("/buscar")
    public ResponseEntity<Map<String, Object>> search(
            @RequestBody(required = false) Map<String, Object> body,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(name = GatewayHeaders.CORRELATION_ID, required = false) String correlationId,
            HttpServletRequest request) {
        SearchResponse response = searchService.search(body, authorization, correlationId, ClientKeyUtil.resolve(request));
        return ResponseEntity.status(response.getStatus()).body(response.getBody());
    }
}
