package com.hao.gateway.common.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 窗口限流注解
 *
 * 注解职责：
 * 标记需要按客户端地址做窗口限流的入口方法，policy 对应 gateway.rate-limit.policies 下的策略名。
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface SlidingWindowLimit {

    /**
     * 限流策略名，如 login、signup
     */
    String policy();

    /**
     * 限流后返回的提示信息
     */
    String message() default "Muitas tentativas. Aguarde um momento e tente novamente.";
}
