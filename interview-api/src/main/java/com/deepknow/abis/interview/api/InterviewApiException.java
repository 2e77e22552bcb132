package com.deepknow.abis.interview.api;

import java.io.Serializable;

/**
 * RPC 层统一异常：code 与服务端域异常码一致（NOT_FOUND、ALREADY_OPEN、SESSION_STATE、
 * ASSESSMENT_IN_PROGRESS、CONFIGURATION、INVALID_ARGUMENT 等），消费方按 code 分支处理。
 */
public class InterviewApiException extends RuntimeException implements Serializable {
    private static final long serialVersionUID = -3920483351622081234L;

    private final String code;

    public InterviewApiException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
