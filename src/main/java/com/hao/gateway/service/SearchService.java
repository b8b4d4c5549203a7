package com.hao.gateway.service;

import com.hao.gateway.common.model.SearchResponse;

import java.util.Map;

/**
 * 搜索协调服务接口
 *
 * 类职责：
 * 校验并转发浏览器发起的搜索请求，处理后端瞬时故障与超时，为结果附加可信度评分。
 */
public interface SearchService {

    /**
     * 执行一次搜索
     *
     * 实现逻辑：
     * 1. 鉴权与限流。
     * 2. 参数校验与后端配置检查。
     * 3. 带重试地调用后端，附加 search_id、关联 ID 与可信度。
     *
     * @param request               客户端 JSON 请求体
     * @param authorization         Authorization 头，需为 Bearer 形式
     * @param inboundCorrelationId  入站 X-Correlation-ID，可为 null
     * @param clientKey             限流使用的客户端标识
     * @return 状态码与正文，不抛出已分类的失败
     */
    SearchResponse search(Map<String, Object> request, String authorization, String inboundCorrelationId, String clientKey);
}
