package com.deepknow.abis.interview.domain.scoring;

/**
 * 进程级评分权重。读取总是拿到一对一致的值；更新整体原子替换，校验失败时保留旧值。
 */
public interface ScoringWeightsStore {
    ScoringWeights current();

    /**
     * @throws com.deepknow.abis.interview.domain.error.ConfigurationException 权重非法（如和不为 100）
     */
    ScoringWeights update(int aiWeight, int manualWeight);
}
