package com.hao.gateway.common.exception;

import com.hao.gateway.common.constants.GatewayHeaders;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.http.converter.HttpMessageNotReadableException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全局异常处理器
 *
 * 类职责：
 * 统一捕获 Controller 层抛出的异常，转换为结构化 JSON 响应，不向客户端暴露堆栈。
 *
 * 实现思路：
 * - RateLimitException：429，正文携带 retry_after_seconds，并写入标准 Retry-After 头。
 * - 参数缺失、请求体不可解析：400。
 * - Exception 兜底：500，记录完整堆栈。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理限流异常
     *
     * 限流属于预期内的保护行为，记录 WARN 而不是 ERROR。
     *
     * @param e 限流异常对象
     * @param request 请求上下文
     * @return 429 响应
     */
    @ExceptionHandler(RateLimitException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimitException(RateLimitException e, WebRequest request) {
        log.warn("触发限流保护|Rate_limit_triggered,path={},retryAfter={}s", getRequestPath(request), e.getRetryAfterSeconds());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("code", HttpStatus.TOO_MANY_REQUESTS.value());
        result.put("message", "Muitas requisições. Aguarde um momento e tente novamente.");
        result.put("detail", e.getMessage());
        result.put("retry_after_seconds", e.getRetryAfterSeconds());
        String correlationId = MDC.get(GatewayHeaders.MDC_CORRELATION_ID);
        if (correlationId != null) {
            result.put("correlation_id", correlationId);
        }
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
                .body(result);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e, WebRequest request) {
        log.warn("请求参数错误|Bad_request,path={},message={}", getRequestPath(request), e.getMessage());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("code", HttpStatus.BAD_REQUEST.value());
        result.put("message", "Requisição inválida. Verifique os dados e tente novamente.");
        return ResponseEntity.badRequest().body(result);
    }

    /**
     * 处理系统兜底异常
     *
     * @param e 未知异常对象
     * @param request 请求上下文
     * @return 500 响应
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e, WebRequest request) {
        log.error("系统未知异常|System_unknown_error,path={},message={}", getRequestPath(request), e.getMessage(), e);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("code", HttpStatus.INTERNAL_SERVER_ERROR.value());
        result.put("message", "Erro interno do servidor");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
    }

    private String getRequestPath(WebRequest request) {
        // getDescription(false) 形如 "uri=/path"
        return request.getDescription(false).replace("uri=", "");
    }
}
