package com.deepknow.abis.interview.domain.assessment.service;

import com.deepknow.abis.interview.domain.assessment.model.Assessment;
import com.deepknow.abis.interview.domain.assessment.model.AssessmentRunResult;
import com.deepknow.abis.interview.domain.assessment.model.AssessmentSummary;
import com.deepknow.abis.interview.domain.assessment.model.Indicator;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 会后批量评估：转写 → 逐指标抽取证据与 AI 分 → 写入评估；以及人工评分与汇总读取。
 */
public interface AssessmentProcessingService {

    /**
     * 同步执行完整评估。转写失败时返回 FAILED 结果，不写入任何 AI 字段。
     *
     * @param audioArtifactRef 为 null 时使用会话记录中的音频产物
     */
    AssessmentRunResult runAssessment(String sessionId, String audioArtifactRef, List<Indicator> indicators);

    /**
     * 异步提交评估；同一会话已有运行中的评估时抛出 AssessmentInProgressException。
     */
    CompletableFuture<AssessmentRunResult> submitAssessment(String sessionId, String audioArtifactRef, List<Indicator> indicators);

    /**
     * 基于已保存的转写重新评估单个指标，只覆盖 AI 字段。
     */
    Assessment reassessIndicator(String sessionId, Indicator indicator);

    Assessment submitManualScore(String sessionId, Long indicatorId, Double manualScore, String notes);

    AssessmentSummary summarize(String sessionId, List<Indicator> indicators);
}
