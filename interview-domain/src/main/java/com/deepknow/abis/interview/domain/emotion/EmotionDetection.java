package com.deepknow.abis.interview.domain.emotion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单次检测结果：标签 + 置信度（[0,1]），可附带各标签的原始分布。
 */
public class EmotionDetection {
    private final String label;
    private final double confidence;
    private final Map<String, Double> scores;

    public EmotionDetection(String label, double confidence, Map<String, Double> scores) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label must not be blank");
        }
        if (Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be a number");
        }
        this.label = label.trim().toLowerCase();
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.scores = scores == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public static EmotionDetection of(String label, double confidence) {
        return new EmotionDetection(label, confidence, null);
    }

    public String getLabel() { return label; }
    public double getConfidence() { return confidence; }
    public Map<String, Double> getScores() { return scores; }

    @Override
    public String toString() {
        return "EmotionDetection{" +
                "label='" + label + '\'' +
                ", confidence=" + confidence +
                '}';
    }
}
