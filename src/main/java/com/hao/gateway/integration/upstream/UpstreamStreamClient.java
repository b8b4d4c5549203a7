package com.hao.gateway.integration.upstream;

import java.io.IOException;
import java.util.Map;

/**
 * 上游流式客户端
 */
public interface UpstreamStreamClient {

    /**
     * 打开一个 GET 流式连接，返回时已读到状态行与响应头
     *
     * @param url 完整地址
     * @param headers 请求头
     * @return 上游连接
     * @throws UpstreamConnectException 无法建立连接
     * @throws IOException 其他传输错误（含读取超时）
     */
    UpstreamConnection open(String url, Map<String, String> headers) throws IOException;
}
