package com.deepknow.abis.interview.domain.emotion;

/**
 * 单个通道的实时视图。
 * confidence 取最近一次样本（当下的把握），stability 反映窗口内的一致性；
 * stability 为 null 表示空窗口且策略为 UNDEFINED。
 */
public final class ModalitySnapshot {
    private final String label;
    private final String dominantLabel;
    private final Double confidence;
    private final Double stability;
    private final int windowSamples;

    public ModalitySnapshot(String label, String dominantLabel, Double confidence, Double stability, int windowSamples) {
        this.label = label;
        this.dominantLabel = dominantLabel;
        this.confidence = confidence;
        this.stability = stability;
        this.windowSamples = windowSamples;
    }

    public String getLabel() { return label; }
    public String getDominantLabel() { return dominantLabel; }
    public Double getConfidence() { return confidence; }
    public Double getStability() { return stability; }
    public int getWindowSamples() { return windowSamples; }

    public boolean isEmpty() { return label == null; }

    @Override
    public String toString() {
        return "ModalitySnapshot{" +
                "label='" + label + '\'' +
                ", dominantLabel='" + dominantLabel + '\'' +
                ", confidence=" + confidence +
                ", stability=" + stability +
                ", windowSamples=" + windowSamples +
                '}';
    }
}
