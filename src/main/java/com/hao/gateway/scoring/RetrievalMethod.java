package com.hao.gateway.scoring;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 结果获取方式
 */
@Getter
@AllArgsConstructor
public enum RetrievalMethod {

    LIVE("live", 1.0),
    CACHE_FRESH("cache_fresh", 0.8),
    CACHE_STALE("cache_stale", 0.4);

    private final String value;

    private final double score;

    /**
     * 按线上取值查找，未知或 null 返回 null
     */
    public static RetrievalMethod fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RetrievalMethod method : values()) {
            if (method.value.equals(value)) {
                return method;
            }
        }
        return null;
    }
}
