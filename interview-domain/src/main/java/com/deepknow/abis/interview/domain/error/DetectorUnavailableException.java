package com.deepknow.abis.interview.domain.error;

/**
 * 情绪检测适配器调用失败。仅在直播链路内部处理：丢帧并记录日志，不会中断会话。
 */
public class DetectorUnavailableException extends InterviewException {
    public DetectorUnavailableException(String message) {
        super("DETECTOR_UNAVAILABLE", message);
    }

    public DetectorUnavailableException(String message, Throwable cause) {
        super("DETECTOR_UNAVAILABLE", message, cause);
    }
}
