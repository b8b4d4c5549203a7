package com.hao.gateway.integration.upstream;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.apache.hc.client5.http.HttpHostConnectException;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.io.InputStream;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Map;

/**
 * 基于 Apache HttpClient 5 的上游流式客户端
 *
 * 实现思路：
 * - 与 RestTemplate 共用连接池。
 * - responseTimeout 即套接字读超时，设为空闲阈值：等待响应头与流中任意两次数据之间都受其约束。
 * - HttpGet 本身实现 Cancellable，abort 直接调用 cancel() 中断阻塞读取。
 */
@Slf4j
public class HttpClientUpstreamStreamClient implements UpstreamStreamClient {

    private final CloseableHttpClient httpClient;

    private final RequestConfig requestConfig;

    public HttpClientUpstreamStreamClient(CloseableHttpClient httpClient, Duration connectTimeout, Duration idleTimeout) {
        this.httpClient = httpClient;
        this.requestConfig = RequestConfig.custom()
                .setConnectTimeout(Timeout.of(connectTimeout))
                .setConnectionRequestTimeout(Timeout.of(connectTimeout))
                .setResponseTimeout(Timeout.of(idleTimeout))
                .build();
    }

    @Override
    public UpstreamConnection open(String url, Map<String, String> headers) throws IOException {
        HttpGet get = new HttpGet(url);
        get.setConfig(requestConfig);
        headers.forEach(get::setHeader);

        try {
            ClassicHttpResponse response = httpClient.executeOpen(null, get, null);
            return new HttpClientUpstreamConnection(get, response);
        } catch (ConnectTimeoutException | HttpHostConnectException | UnknownHostException e) {
            throw new UpstreamConnectException("Failed to connect to " + url, e);
        }
    }

    private static final class HttpClientUpstreamConnection implements UpstreamConnection {

        private final HttpGet request;

        private final ClassicHttpResponse response;

        private HttpClientUpstreamConnection(HttpGet request, ClassicHttpResponse response) {
            this.request = request;
            this.response = response;
        }

        @Override
        public int status() {
            return response.getCode();
        }

        @Override
        public InputStream body() throws IOException {
            HttpEntity entity = response.getEntity();
            return entity != null ? entity.getContent() : null;
        }

        @Override
        public void abort() {
            request.cancel();
        }

        @Override
        public void close() throws IOException {
            response.close();
        }
    }
}
