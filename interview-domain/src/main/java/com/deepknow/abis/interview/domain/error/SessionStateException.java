package com.deepknow.abis.interview.domain.error;

/**
 * 当前会话状态不允许该操作（如关闭后继续推帧）。
 */
public class SessionStateException extends InterviewException {
    public SessionStateException(String message) {
        super("SESSION_STATE", message);
    }
}
