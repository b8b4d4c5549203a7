package com.hao.gateway.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP 客户端配置
 *
 * 类职责：
 * 构建带连接池的 HttpClient，供 RestTemplate（搜索、身份转发）与 SSE 上游中继共用。
 *
 * 核心实现思路：
 * - 连接池管理连接，补齐空闲连接与过期连接回收。
 * - 建连超时放在连接池的 ConnectionConfig 上；响应超时取 gateway.backend.search-timeout
 *   （多州查询耗时较长），作为客户端默认 RequestConfig。SSE 中继按请求覆盖为空闲阈值。
 * - 非 2xx 不抛异常，由调用方按状态码分类处理。
 */
@Slf4j
@Configuration
public class RestTemplateConfig {

    @Bean(destroyMethod = "close")
    public CloseableHttpClient gatewayHttpClient(GatewayProperties properties) {
        GatewayProperties.Backend backend = properties.getBackend();
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        // 每个进度流独占一条连接直至搜索结束，上限按并发搜索数估算
        connectionManager.setMaxTotal(1000);
        connectionManager.setDefaultMaxPerRoute(500);
        connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.of(backend.getConnectTimeout()))
                .build());

        RequestConfig defaultRequestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.of(backend.getConnectTimeout()))
                .setResponseTimeout(Timeout.of(backend.getSearchTimeout()))
                .build();
        log.info("HTTP客户端创建|Http_client_created,connectTimeout={},responseTimeout={}",
                backend.getConnectTimeout(), backend.getSearchTimeout());

        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(defaultRequestConfig)
                .evictIdleConnections(TimeValue.ofMinutes(1))
                .evictExpiredConnections()
                .disableAutomaticRetries()
                .build();
    }

    @Bean
    public RestTemplate restTemplate(CloseableHttpClient gatewayHttpClient) {
        // 超时全部来自客户端默认配置，工厂上不再单独设置
        HttpComponentsClientHttpRequestFactory requestFactory = new HttpComponentsClientHttpRequestFactory(gatewayHttpClient);

        RestTemplate restTemplate = new RestTemplate(requestFactory);
        restTemplate.setErrorHandler(new DefaultResponseErrorHandler() {
            @Override
            public boolean hasError(ClientHttpResponse response) {
                return false;
            }
        });
        return restTemplate;
    }
}
