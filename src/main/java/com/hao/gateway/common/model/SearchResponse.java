package com.hao.gateway.common.model;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 搜索协调结果：HTTP 状态码 + JSON 正文
 */
@Value
public class SearchResponse {

    int status;

    Map<String, Object> body;

    public static SearchResponse of(int status, Map<String, Object> body) {
        return new SearchResponse(status, body);
    }

    public static SearchResponse message(int status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        return new SearchResponse(status, body);
    }
}
