package com.deepknow.abis.interview.domain.scoring;

import com.deepknow.abis.interview.domain.assessment.model.Indicator;
import com.deepknow.abis.interview.domain.error.ConfigurationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * AI/人工分数合成与指标加权汇总。无状态，权重由调用方每次显式传入。
 * <p>
 * 人工分缺失或 ≤ 0 时视为"尚未录入"，直接返回 AI 分；否则按权重混合并保留一位小数（HALF_UP）。
 */
public final class ScoreCombiner {

    private ScoreCombiner() {}

    public static double combine(double aiScore, Double manualScore, ScoringWeights weights) {
        if (weights == null) {
            throw new ConfigurationException("Scoring weights are not configured");
        }
        if (manualScore == null || manualScore <= 0) {
            return aiScore;
        }
        BigDecimal ai = BigDecimal.valueOf(aiScore).multiply(BigDecimal.valueOf(weights.getAiWeight()));
        BigDecimal manual = BigDecimal.valueOf(manualScore).multiply(BigDecimal.valueOf(weights.getManualWeight()));
        return ai.add(manual)
                .divide(BigDecimal.valueOf(100), 10, RoundingMode.HALF_UP)
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
    }

    /**
     * 按指标权重求加权平均：Σ(score_i × weight_i) / Σ(weight_i)。
     * 没有分数的指标同时从分子与分母中剔除；一个都没有时返回 empty。
     */
    public static OptionalDouble overall(Map<Long, Double> indicatorScores, List<Indicator> indicators) {
        if (indicatorScores == null || indicators == null) return OptionalDouble.empty();
        BigDecimal weighted = BigDecimal.ZERO;
        BigDecimal totalWeight = BigDecimal.ZERO;
        for (Indicator indicator : indicators) {
            Double score = indicatorScores.get(indicator.getId());
            if (score == null) continue;
            BigDecimal w = BigDecimal.valueOf(indicator.getWeight());
            weighted = weighted.add(BigDecimal.valueOf(score).multiply(w));
            totalWeight = totalWeight.add(w);
        }
        if (totalWeight.signum() == 0) return OptionalDouble.empty();
        return OptionalDouble.of(weighted
                .divide(totalWeight, 10, RoundingMode.HALF_UP)
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue());
    }

    public static double roundOneDecimal(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
