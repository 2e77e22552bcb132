package com.deepknow.abis.interview.domain.error;

/**
 * 入站帧校验失败：类型未知、负载为空、无法解码、超限或格式不符。
 */
public class InvalidFrameException extends InterviewException {
    public InvalidFrameException(String message) {
        super("INVALID_FRAME", message);
    }
}
