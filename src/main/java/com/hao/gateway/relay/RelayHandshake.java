package com.hao.gateway.relay;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 建连阶段的结果：要么得到可转发的会话，要么已经终止
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RelayHandshake {

    private final StreamSession session;

    private final RelayOutcome outcome;

    static RelayHandshake streaming(StreamSession session) {
        return new RelayHandshake(session, null);
    }

    static RelayHandshake terminated(RelayOutcome outcome) {
        return new RelayHandshake(null, outcome);
    }

    public boolean isStreaming() {
        return session != null;
    }
}
