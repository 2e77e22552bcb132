package com.deepknow.abis.interview.domain.scoring;

import com.deepknow.abis.interview.domain.error.ConfigurationException;

/**
 * AI/人工评分权重对（百分比）。不可变，构造即校验：两者均 ≥ 0 且和为 100。
 * 更新时整体替换，从不单独修改某一字段。
 */
public final class ScoringWeights {
    public static final ScoringWeights DEFAULT = new ScoringWeights(60, 40);

    private final int aiWeight;
    private final int manualWeight;

    public ScoringWeights(int aiWeight, int manualWeight) {
        if (aiWeight < 0 || manualWeight < 0) {
            throw new ConfigurationException("Scoring weights must be non-negative: ai=" + aiWeight + ", manual=" + manualWeight);
        }
        if (aiWeight + manualWeight != 100) {
            throw new ConfigurationException("Scoring weights must sum to 100: ai=" + aiWeight + ", manual=" + manualWeight
                    + " (sum=" + (aiWeight + manualWeight) + ")");
        }
        this.aiWeight = aiWeight;
        this.manualWeight = manualWeight;
    }

    public static ScoringWeights of(int aiWeight, int manualWeight) {
        return new ScoringWeights(aiWeight, manualWeight);
    }

    public int getAiWeight() { return aiWeight; }
    public int getManualWeight() { return manualWeight; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScoringWeights)) return false;
        ScoringWeights that = (ScoringWeights) o;
        return aiWeight == that.aiWeight && manualWeight == that.manualWeight;
    }

    @Override
    public int hashCode() {
        return 31 * aiWeight + manualWeight;
    }

    @Override
    public String toString() {
        return "ScoringWeights{ai=" + aiWeight + ", manual=" + manualWeight + '}';
    }
}
