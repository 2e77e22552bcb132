package com.deepknow.abis.interview.domain.assessment.service;

import com.deepknow.abis.interview.domain.assessment.model.Assessment;

/**
 * 出站事件：每次成功抽取后通知一次。
 */
public interface AssessmentListener {
    void onAssessmentReady(String sessionId, Long indicatorId, Assessment assessment);
}
