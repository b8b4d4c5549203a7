package com.hao.gateway.relay;

import lombok.Builder;
import lombok.Value;

/**
 * 客户端的进度流请求
 */
@Value
@Builder
public class StreamRequest {

    String searchId;

    /** 可选的 Bearer 凭证（不含 "Bearer " 前缀） */
    String token;

    /** 可选的入站关联 ID，原样转发 */
    String correlationId;
}
