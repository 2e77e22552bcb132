package com.deepknow.abis.interview.domain.emotion;

import java.util.Optional;

public class MockVoiceEmotionDetector implements VoiceEmotionDetector {

    @Override
    public Optional<EmotionDetection> detect(byte[] pcmWindow, int sampleRate) {
        if (pcmWindow == null || pcmWindow.length == 0) return Optional.empty();
        return Optional.of(EmotionDetection.of("neutral", 0.8));
    }
}
