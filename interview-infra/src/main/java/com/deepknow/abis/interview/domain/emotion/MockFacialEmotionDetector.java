package com.deepknow.abis.interview.domain.emotion;

import java.util.Arrays;
import java.util.Optional;

/**
 * 本地开发用：按图像内容哈希在固定标签集中确定性地取一个结果。
 */
public class MockFacialEmotionDetector implements FacialEmotionDetector {
    private static final String[] LABELS = {"neutral", "happy", "neutral", "surprise", "neutral", "sad"};

    @Override
    public Optional<EmotionDetection> detect(byte[] image) {
        if (image == null || image.length == 0) return Optional.empty();
        int h = Arrays.hashCode(image) & 0x7fffffff;
        return Optional.of(EmotionDetection.of(LABELS[h % LABELS.length], 0.6 + (h % 40) / 100.0));
    }
}
