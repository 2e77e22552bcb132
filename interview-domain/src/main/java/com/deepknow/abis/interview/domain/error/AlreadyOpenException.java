package com.deepknow.abis.interview.domain.error;

/**
 * 同一 sessionId 已存在活跃的直播会话。
 */
public class AlreadyOpenException extends InterviewException {
    public AlreadyOpenException(String message) {
        super("ALREADY_OPEN", message);
    }
}
