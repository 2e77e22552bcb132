package com.deepknow.abis.interview.domain.session.model;

/**
 * 直播会话状态机：IDLE → OPEN → CLOSING → CLOSED；异常断开时 OPEN → CLOSED。
 */
public enum SessionState {
    IDLE,
    OPEN,
    CLOSING,
    CLOSED;

    public boolean acceptsFrames() { return this == OPEN; }

    public boolean servesSnapshots() { return this == OPEN || this == CLOSING; }
}
