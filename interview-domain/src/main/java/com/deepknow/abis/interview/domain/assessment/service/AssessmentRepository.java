package com.deepknow.abis.interview.domain.assessment.service;

import com.deepknow.abis.interview.domain.assessment.model.Assessment;

import java.util.List;

public interface AssessmentRepository {
    /**
     * 写入或覆盖 AI 字段（aiScore/evidence/reasoning），已存在的人工分原样保留。
     */
    Assessment upsertAiResult(String sessionId, Long indicatorId, double aiScore, String evidence, String reasoning);

    /**
     * 只更新人工字段；行不存在时返回 null。
     */
    Assessment updateManualScore(String sessionId, Long indicatorId, Double manualScore, String notes);

    Assessment find(String sessionId, Long indicatorId);

    List<Assessment> listBySession(String sessionId);
}
