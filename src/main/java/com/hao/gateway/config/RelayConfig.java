package com.hao.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.hao.gateway.integration.upstream.HttpClientUpstreamStreamClient;
import com.hao.gateway.integration.upstream.UpstreamStreamClient;
import com.hao.gateway.relay.StreamingRelay;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * SSE 中继配置
 *
 * 类职责：
 * 装配上游流式客户端、中继转发线程池与空闲看门狗调度器。
 *
 * 实现思路：
 * - 转发线程在整个搜索期间阻塞读取上游，使用独立线程池，不占用 Tomcat 请求线程。
 * - 看门狗使用单线程守护调度器，只做时间比较与中断，不执行 IO。
 */
@Configuration
public class RelayConfig {

    @Bean
    public UpstreamStreamClient upstreamStreamClient(CloseableHttpClient gatewayHttpClient, GatewayProperties properties) {
        return new HttpClientUpstreamStreamClient(gatewayHttpClient,
                properties.getBackend().getConnectTimeout(),
                properties.getRelay().getIdleTimeout());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService relayWatchdogExecutor() {
        return Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("relay-watchdog-%d")
                .setDaemon(true)
                .build());
    }

    @Bean
    public ThreadPoolTaskExecutor relayExecutor(GatewayProperties properties) {
        GatewayProperties.Relay relay = properties.getRelay();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(relay.getCorePoolSize());
        executor.setMaxPoolSize(relay.getMaxPoolSize());
        executor.setQueueCapacity(relay.getQueueCapacity());
        executor.setThreadNamePrefix("sse-relay-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public StreamingRelay streamingRelay(GatewayProperties properties, UpstreamStreamClient upstreamStreamClient,
                                         ScheduledExecutorService relayWatchdogExecutor, ObjectMapper objectMapper) {
        return new StreamingRelay(properties, upstreamStreamClient, relayWatchdogExecutor, objectMapper);
    }
}
