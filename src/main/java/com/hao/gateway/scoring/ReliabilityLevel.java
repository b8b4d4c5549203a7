package com.hao.gateway.scoring;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 可信度等级，取值直接面向前端展示
 */
@Getter
@AllArgsConstructor
public enum ReliabilityLevel {

    ALTA("Alta"),
    MEDIA("Media"),
    BAIXA("Baixa");

    @JsonValue
    private final String label;

    static ReliabilityLevel of(double score) {
        if (score > 0.8) {
            return ALTA;
        }
        if (score >= 0.5) {
            return MEDIA;
        }
        return BAIXA;
    }
}
