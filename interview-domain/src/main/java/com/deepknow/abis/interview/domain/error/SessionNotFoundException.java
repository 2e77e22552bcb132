package com.deepknow.abis.interview.domain.error;

/**
 * 会话不存在或未登记。
 */
public class SessionNotFoundException extends InterviewException {
    public SessionNotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
