package com.hao.gateway.common.util;

import com.hao.gateway.common.constants.GatewayHeaders;
import com.hao.gateway.common.constants.RateLimitConstants;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

/**
 * 客户端标识解析
 *
 * 限流按客户端地址计数。网关部署在反向代理之后，remoteAddr 是代理地址，
 * 因此只认转发头；都缺失时归入 "unknown"。
 */
public final class ClientKeyUtil {

    private ClientKeyUtil() {
    }

    /**
     * 解析客户端标识
     *
     * 实现逻辑：
     * 1. X-Forwarded-For 取第一个地址（最初的客户端）。
     * 2. 其次 X-Real-IP。
     * 3. 兜底返回 unknown。
     *
     * @param request 请求对象，可为 null
     * @return 客户端标识
     */
    public static String resolve(HttpServletRequest request) {
        if (request == null) {
            return RateLimitConstants.UNKNOWN_CLIENT;
        }
        String forwarded = request.getHeader(GatewayHeaders.FORWARDED_FOR);
        if (StringUtils.hasText(forwarded)) {
            String first = forwarded.split(",")[0].trim();
            if (StringUtils.hasText(first) && !RateLimitConstants.UNKNOWN_CLIENT.equalsIgnoreCase(first)) {
                return first;
            }
        }
        String realIp = request.getHeader(GatewayHeaders.REAL_IP);
        if (StringUtils.hasText(realIp) && !RateLimitConstants.UNKNOWN_CLIENT.equalsIgnoreCase(realIp.trim())) {
            return realIp.trim();
        }
        return RateLimitConstants.UNKNOWN_CLIENT;
    }
}
