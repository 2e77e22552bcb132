package com.deepknow.abis.interview.domain.emotion;

/**
 * 派生视图，不单独存储：按需从最近窗口的样本计算。
 */
public final class EmotionSnapshot {
    private final String sessionId;
    private final ModalitySnapshot facial;
    private final ModalitySnapshot voice;
    private final long totalSamples;

    public EmotionSnapshot(String sessionId, ModalitySnapshot facial, ModalitySnapshot voice, long totalSamples) {
        this.sessionId = sessionId;
        this.facial = facial;
        this.voice = voice;
        this.totalSamples = totalSamples;
    }

    public String getSessionId() { return sessionId; }
    public ModalitySnapshot getFacial() { return facial; }
    public ModalitySnapshot getVoice() { return voice; }
    public long getTotalSamples() { return totalSamples; }

    public ModalitySnapshot get(Modality modality) {
        return modality == Modality.FACIAL ? facial : voice;
    }

    @Override
    public String toString() {
        return "EmotionSnapshot{" +
                "sessionId='" + sessionId + '\'' +
                ", facial=" + facial +
                ", voice=" + voice +
                ", totalSamples=" + totalSamples +
                '}';
    }
}
