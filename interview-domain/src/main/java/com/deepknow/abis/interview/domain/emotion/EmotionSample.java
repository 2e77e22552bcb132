package com.deepknow.abis.interview.domain.emotion;

/**
 * 追加写入的情绪样本，创建后不可变。
 */
public final class EmotionSample {
    private final String sessionId;
    private final double timestampSeconds;
    private final Modality modality;
    private final String label;
    private final double confidence;

    public EmotionSample(String sessionId, double timestampSeconds, Modality modality, String label, double confidence) {
        if (modality == null) throw new IllegalArgumentException("modality is required");
        if (label == null || label.isBlank()) throw new IllegalArgumentException("label is required");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
        this.sessionId = sessionId;
        this.timestampSeconds = timestampSeconds;
        this.modality = modality;
        this.label = label;
        this.confidence = confidence;
    }

    public String getSessionId() { return sessionId; }
    public double getTimestampSeconds() { return timestampSeconds; }
    public Modality getModality() { return modality; }
    public String getLabel() { return label; }
    public double getConfidence() { return confidence; }

    @Override
    public String toString() {
        return "EmotionSample{" +
                "sessionId='" + sessionId + '\'' +
                ", t=" + timestampSeconds +
                ", modality=" + modality +
                ", label='" + label + '\'' +
                ", confidence=" + confidence +
                '}';
    }
}
