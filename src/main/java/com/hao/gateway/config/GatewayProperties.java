package com.hao.gateway.config;

import com.hao.gateway.common.constants.RateLimitConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 网关配置项
 *
 * 类职责：
 * 绑定 application.yml 中 gateway.* 前缀的配置，供后端调用、SSE 中继与限流策略使用。
 *
 * 注意：
 * 后端地址缺省为空字符串，缺失时由调用方返回 503，不做本地回退。
 */
@Data
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    private Backend backend = new Backend();

    private Identity identity = new Identity();

    private Relay relay = new Relay();

    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class Backend {

        /** 后端搜索服务基础地址（通常来自环境变量 BACKEND_URL） */
        private String url = "";

        /** 建连超时 */
        private Duration connectTimeout = Duration.ofSeconds(3);

        /** 搜索请求读取超时，多州长时间查询需要较大值 */
        private Duration searchTimeout = Duration.ofMinutes(5);

        /** 最大尝试次数（含首次） */
        private int maxAttempts = 2;

        /** 每次尝试前的等待时间，下标与尝试序号对应 */
        private List<Duration> retryDelays = new ArrayList<>(List.of(Duration.ZERO, Duration.ofSeconds(3)));

        /** 可重试的后端状态码；502 表示后端已在内部重试过，不再重试 */
        private List<Integer> retryableStatuses = new ArrayList<>(List.of(503));

        public boolean isConfigured() {
            return StringUtils.hasText(url);
        }
    }

    @Data
    public static class Identity {

        /** 身份服务地址，登录与注册请求原样转发 */
        private String url = "";

        public boolean isConfigured() {
            return StringUtils.hasText(url);
        }
    }

    @Data
    public static class Relay {

        /** 上游无数据的最长静默时间，超过即判定为超时 */
        private Duration idleTimeout = Duration.ofMinutes(2);

        /** 单次转发的最大字节数 */
        private int chunkSize = 8192;

        private int corePoolSize = 16;

        private int maxPoolSize = 256;

        private int queueCapacity = 0;
    }

    @Data
    public static class RateLimit {

        /** 过期条目清理间隔 */
        private Duration sweepInterval = Duration.ofMinutes(1);

        /** 每个策略最多跟踪的客户端数 */
        private long maxTrackedKeys = RateLimitConstants.MAX_TRACKED_KEYS;

        private Map<String, Policy> policies = new LinkedHashMap<>();
    }

    @Data
    public static class Policy {

        private int limit;

        private Duration window;
    }
}
