package com.hao.gateway.scoring;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 搜索结果可信度评分
 *
 * 类职责：
 * 根据数据源覆盖率、数据新鲜度与获取方式给出 0~1 的综合评分与等级。
 *
 * 评分公式：
 * score = 0.5 * coverage + 0.3 * freshness + 0.2 * method，四舍五入保留两位小数。
 *
 * 注意：
 * 纯计算，无 IO，可在任意线程调用。
 */
@Component
public class ReliabilityScorer {

    private static final double COVERAGE_WEIGHT = 0.5;
    private static final double FRESHNESS_WEIGHT = 0.3;
    private static final double METHOD_WEIGHT = 0.2;

    /** 未知获取方式按陈旧缓存计分 */
    private static final double UNKNOWN_METHOD_SCORE = 0.4;

    public double freshnessScore(long minutes) {
        if (minutes < 5) {
            return 1.0;
        }
        if (minutes < 60) {
            return 0.7;
        }
        if (minutes < 360) {
            return 0.4;
        }
        return 0.1;
    }

    public double methodScore(String method) {
        RetrievalMethod retrievalMethod = RetrievalMethod.fromValue(method);
        return retrievalMethod == null ? UNKNOWN_METHOD_SCORE : retrievalMethod.getScore();
    }

    /**
     * 根据后端响应状态推导获取方式
     *
     * @param responseState live / degraded / cached，null 视为 live
     * @param cacheStatus   fresh / stale，仅 cached 时有意义
     */
    public String deriveMethod(String responseState, String cacheStatus) {
        if (responseState == null || "live".equals(responseState) || "degraded".equals(responseState)) {
            return RetrievalMethod.LIVE.getValue();
        }
        if ("cached".equals(responseState) && "fresh".equals(cacheStatus)) {
            return RetrievalMethod.CACHE_FRESH.getValue();
        }
        return RetrievalMethod.CACHE_STALE.getValue();
    }

    /**
     * 计算可信度
     *
     * @param coveragePct      数据源覆盖率百分比，超出 [0,100] 的部分截断
     * @param freshnessMinutes 数据年龄（分钟）
     * @param method           获取方式
     * @return 评分结果
     */
    public ReliabilityResult calculateReliability(double coveragePct, long freshnessMinutes, String method) {
        double coverage = Math.max(0.0, Math.min(100.0, coveragePct)) / 100.0;
        double raw = COVERAGE_WEIGHT * coverage
                + FRESHNESS_WEIGHT * freshnessScore(freshnessMinutes)
                + METHOD_WEIGHT * methodScore(method);
        // BigDecimal.valueOf 走十进制字符串，避免 0.105 之类的二进制误差影响进位
        double score = BigDecimal.valueOf(raw).setScale(2, RoundingMode.HALF_UP).doubleValue();

        return ReliabilityResult.builder()
                .score(score)
                .level(ReliabilityLevel.of(score))
                .freshnessMinutes(freshnessMinutes)
                .method(method)
                .build();
    }

    /**
     * 元数据不足时的兜底结果
     */
    public ReliabilityResult unavailable(Long freshnessMinutes, String method) {
        return ReliabilityResult.builder()
                .score(0.0)
                .level(ReliabilityLevel.BAIXA)
                .freshnessMinutes(freshnessMinutes)
                .method(method)
                .build();
    }
}
