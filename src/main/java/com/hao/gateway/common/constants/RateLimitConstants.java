package com.hao.gateway.common.constants;

/**
 * 限流策略常量定义
 *
 * 类职责：
 * 集中管理限流策略名称与缺省阈值，配合 @SlidingWindowLimit 注解使用。
 * 实际阈值以 gateway.rate-limit.policies.* 配置为准，此处仅为缺省值。
 */
public class RateLimitConstants {

    /** 登录：5 次 / 5 分钟 */
    public static final String POLICY_LOGIN = "login";
    public static final int LOGIN_LIMIT = 5;
    public static final long LOGIN_WINDOW_MINUTES = 5;

    /** 注册：3 次 / 10 分钟 */
    public static final String POLICY_SIGNUP = "signup";
    public static final int SIGNUP_LIMIT = 3;
    public static final long SIGNUP_WINDOW_MINUTES = 10;

    /** 搜索：10 次 / 1 分钟，与后端按用户的搜索限额保持一致 */
    public static final String POLICY_SEARCH = "search";
    public static final int SEARCH_LIMIT = 10;
    public static final long SEARCH_WINDOW_MINUTES = 1;

    /** 每个策略最多跟踪的客户端数，超过后拒绝新客户端 */
    public static final long MAX_TRACKED_KEYS = 100_000;

    /** 无法识别客户端地址时使用的哨兵键 */
    public static final String UNKNOWN_CLIENT = "unknown";

    private RateLimitConstants() {
        // 禁止实例化
    }
}
