package com.hao.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 网关启动入口
 *
 * 类职责：
 * 引导 Spring Boot 应用启动，加载网关配置并启用定时任务（限流窗口清理）。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling // 限流条目定时清理依赖调度能力
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
