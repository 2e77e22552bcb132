package com.deepknow.abis.interview.domain.error;

/**
 * 音频转写失败；对该会话的批量评估是致命错误。
 */
public class TranscriptionException extends InterviewException {
    public TranscriptionException(String message) {
        super("TRANSCRIPTION_FAILED", message);
    }

    public TranscriptionException(String message, Throwable cause) {
        super("TRANSCRIPTION_FAILED", message, cause);
    }
}
