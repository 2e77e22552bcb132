package com.deepknow.abis.interview.domain.emotion;

import java.util.Optional;

/**
 * 语音情绪识别适配器。输入为单声道 16bit 小端 PCM 窗口。
 * 静音或过短窗口返回 empty；调用失败抛出 DetectorUnavailableException。
 */
public interface VoiceEmotionDetector {
    Optional<EmotionDetection> detect(byte[] pcmWindow, int sampleRate);
}
