package com.hao.gateway.scoring;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * 可信度评分结果
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReliabilityResult {

    double score;

    ReliabilityLevel level;

    /** 数据年龄（分钟），无法推导时为 null */
    Long freshnessMinutes;

    /** live / cache_fresh / cache_stale，未知时原样保留 */
    String method;
}
