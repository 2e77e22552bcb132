package com.deepknow.abis.interview.domain.assessment;

import com.deepknow.abis.interview.domain.assessment.model.Assessment;
import org.springframework.context.ApplicationEvent;

/**
 * 单个指标评估完成（AI 字段已写入）。
 */
public class AssessmentReadyEvent extends ApplicationEvent {
    private final String sessionId;
    private final Long indicatorId;
    private final Assessment assessment;

    public AssessmentReadyEvent(Object source, String sessionId, Long indicatorId, Assessment assessment) {
        super(source);
        this.sessionId = sessionId;
        this.indicatorId = indicatorId;
        this.assessment = assessment;
    }

    public String getSessionId() { return sessionId; }
    public Long getIndicatorId() { return indicatorId; }
    public Assessment getAssessment() { return assessment; }
}
