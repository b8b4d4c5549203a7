package com.hao.gateway.relay;

/**
 * 中继终止原因
 *
 * 每种原因对应不同的响应，禁止合并为通用错误。
 */
public enum RelayTermination {

    /** 未连接上游即拒绝：缺少 search_id、后端未配置、中继容量耗尽 */
    REJECTED,

    /** 上游正常结束 */
    COMPLETED,

    /** 客户端断开（499），仅作信息记录 */
    CLIENT_DISCONNECTED,

    /** 上游静默超过阈值或传输被中途终止（504） */
    UPSTREAM_TIMEOUT,

    /** 上游返回非成功状态、无响应体或无法连接 */
    UPSTREAM_ERROR
}
