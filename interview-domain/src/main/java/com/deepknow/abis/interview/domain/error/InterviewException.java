package com.deepknow.abis.interview.domain.error;

/**
 * 面试域异常基类：携带稳定的错误码，便于端点层与 RPC 层统一映射。
 */
public class InterviewException extends RuntimeException {
    private final String code;

    public InterviewException(String code, String message) {
        super(message);
        this.code = code;
    }

    public InterviewException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() { return code; }
}
